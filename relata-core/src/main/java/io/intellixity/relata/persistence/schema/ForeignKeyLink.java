package io.intellixity.relata.persistence.schema;

import java.util.List;

/**
 * Physical foreign key behind a relation, identical whichever side it is resolved from.
 *
 * @param ownerModel model whose rows store the foreign key
 * @param ownerFields foreign key fields on the owner
 * @param referencedModel model whose key is referenced
 * @param referencedFields referenced (unique) fields
 * @param nullable every owner field is optional, so the link can be cleared
 * @param unique one-to-one link: at most one owner row per referenced row
 */
public record ForeignKeyLink(
    String ownerModel,
    List<String> ownerFields,
    String referencedModel,
    List<String> referencedFields,
    boolean nullable,
    boolean unique
) {
  public ForeignKeyLink {
    ownerFields = List.copyOf(ownerFields);
    referencedFields = List.copyOf(referencedFields);
    if (ownerFields.isEmpty() || ownerFields.size() != referencedFields.size()) {
      throw new IllegalArgumentException("foreign key fields mismatch: " + ownerModel + ownerFields + " -> " + referencedModel + referencedFields);
    }
  }
}

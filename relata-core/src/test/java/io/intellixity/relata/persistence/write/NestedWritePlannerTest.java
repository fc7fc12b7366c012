package io.intellixity.relata.persistence.write;

import io.intellixity.relata.persistence.error.CardinalityViolationException;
import io.intellixity.relata.persistence.error.ConstraintCycleException;
import io.intellixity.relata.persistence.error.DirectiveValidationException;
import io.intellixity.relata.persistence.plan.*;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import io.intellixity.relata.persistence.schema.UniqueSelector;
import io.intellixity.relata.persistence.schema.yaml.YamlSchemaLoader;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.intellixity.relata.persistence.write.WriteDirective.*;
import static org.junit.jupiter.api.Assertions.*;

final class NestedWritePlannerTest {
  private static final SchemaRegistry SCHEMA = new YamlSchemaLoader().registryFromResource("schema/blog.yml");

  private final NestedWritePlanner planner = new NestedWritePlanner(SCHEMA);

  @Test
  void createWithBackReferencedChild_bindsChildToParentKey() {
    WritePlan plan = planner.planCreate("User", WriteData.builder()
        .set("email", "a@x.io")
        .with("profile", create(WriteData.of(Map.of("bio", "hi"))))
        .build());

    assertEquals(List.of(InsertRow.class, InsertRow.class), kinds(plan));
    InsertRow profile = (InsertRow) plan.steps().get(1);
    assertEquals("Profile", profile.row().model());
    FkBinding fk = profile.foreignKeys().get(0);
    assertEquals(List.of("userId"), fk.fields());
    assertEquals(plan.root(), fk.referenced());
    assertFalse(fk.exclusive());
  }

  @Test
  void connectOnOwnedKey_looksUpTargetBeforeInsert() {
    WritePlan plan = planner.planCreate("Post", WriteData.builder()
        .set("slug", "s").set("title", "T")
        .with("author", connect(UniqueSelector.of("email", "a@x.io")))
        .build());

    assertEquals(List.of(LookupRow.class, InsertRow.class), kinds(plan));
    LookupRow lookup = (LookupRow) plan.steps().get(0);
    InsertRow post = (InsertRow) plan.steps().get(1);
    assertEquals(lookup.row(), post.foreignKeys().get(0).referenced());
    assertEquals(List.of("authorId"), post.foreignKeys().get(0).fields());
    assertEquals("Post/author[0]:connect", lookup.path().toString());
  }

  @Test
  void update_looksUpRootThenWritesScalarsThenChildren() {
    WritePlan plan = planner.planUpdate("User", UniqueSelector.of("email", "a@x.io"), WriteData.builder()
        .set("name", "A")
        .with("posts", create(WriteData.of(Map.of("slug", "s", "title", "T"))))
        .build());

    assertEquals(List.of(LookupRow.class, UpdateRow.class, InsertRow.class), kinds(plan));
    assertEquals(plan.root(), ((InsertRow) plan.steps().get(2)).foreignKeys().get(0).referenced());
  }

  @Test
  void connectOrCreate_carriesItsOwnCreateBranch() {
    WritePlan plan = planner.planCreate("Post", WriteData.builder()
        .set("slug", "s").set("title", "T")
        .with("categories", connectOrCreate(UniqueSelector.of("name", "java"), WriteData.of(Map.of("name", "java"))))
        .build());

    assertEquals(List.of(InsertRow.class, ResolveOrCreate.class, LinkJoinRow.class), kinds(plan));
    ResolveOrCreate step = (ResolveOrCreate) plan.steps().get(1);
    assertEquals(List.of(InsertRow.class), kinds(step.createBranch()));
    LinkJoinRow link = (LinkJoinRow) plan.steps().get(2);
    assertEquals("post_categories", link.joinTable().name());
    assertEquals(plan.root(), link.left());
    assertEquals(step.row(), link.right());
  }

  @Test
  void upsertOnBackReference_bindsOnlyInCreateBranch() {
    WritePlan plan = planner.planUpdate("User", UniqueSelector.of("id", 1L), WriteData.builder()
        .with("profile", upsert(null, WriteData.of(Map.of("bio", "new")), WriteData.of(Map.of("bio", "changed"))))
        .build());

    assertEquals(List.of(LookupRow.class, UpsertRow.class), kinds(plan));
    UpsertRow upsert = (UpsertRow) plan.steps().get(1);
    InsertRow insert = (InsertRow) upsert.createBranch().steps().get(0);
    assertEquals(plan.root(), insert.foreignKeys().get(0).referenced());
    assertTrue(insert.foreignKeys().get(0).exclusive());
    assertEquals(List.of(UpdateRow.class), kinds(upsert.updateBranch()));
  }

  @Test
  void siblingDirectives_keepSubmissionOrder() {
    WritePlan plan = planner.planCreate("User", WriteData.builder()
        .set("email", "a@x.io")
        .with("posts",
            create(WriteData.of(Map.of("slug", "b", "title", "B"))),
            create(WriteData.of(Map.of("slug", "a", "title", "A"))))
        .build());

    List<Object> slugs = new ArrayList<>();
    for (PlanStep s : plan.steps()) {
      if (s instanceof InsertRow ins && ins.row().model().equals("Post")) slugs.add(ins.values().get("slug"));
    }
    assertEquals(List.of("b", "a"), slugs);
  }

  @Test
  void optionalCycle_isSplitIntoInsertAndPatch() {
    WritePlan plan = planner.planCreate("Team", WriteData.builder()
        .set("name", "Reds")
        .with("players", create(WriteData.of(Map.of("name", "Ann"))))
        .with("captain", connect(UniqueSelector.of("name", "Ann")))
        .build());

    assertEquals(List.of(InsertRow.class, InsertRow.class, PatchForeignKey.class), kinds(plan));
    assertTrue(((InsertRow) plan.steps().get(0)).foreignKeys().isEmpty());
    PatchForeignKey patch = (PatchForeignKey) plan.steps().get(2);
    assertEquals(plan.root(), patch.owner());
    assertEquals(List.of("captainId"), patch.fields());
    assertEquals(((InsertRow) plan.steps().get(1)).row(), patch.referenced());
  }

  @Test
  void requiredCycle_isRejected() {
    WriteData data = WriteData.builder()
        .set("name", "h")
        .with("wife", create(WriteData.builder()
            .set("name", "w")
            .with("husband", connect(UniqueSelector.of("name", "h")))
            .build()))
        .build();

    assertThrows(ConstraintCycleException.class, () -> planner.planCreate("Husband", data));
  }

  @Test
  void nonUniqueSelector_isRejectedWithDeclaredConstraints() {
    WriteData data = WriteData.builder()
        .set("body", "b")
        .with("post", connect(UniqueSelector.of("title", "T")))
        .build();

    DirectiveValidationException e = assertThrows(DirectiveValidationException.class, () -> planner.planCreate("Comment", data));
    assertTrue(e.getMessage().contains("not a unique constraint"));
    assertEquals("Comment/post[0]:connect", e.path().toString());
  }

  @Test
  void listOnlyDirectivesOnSingleRelation_areRejected() {
    WriteData set = WriteData.builder().with("profile", WriteDirective.set(UniqueSelector.of("id", 1L))).build();
    WriteData two = WriteData.builder()
        .with("author", connect(UniqueSelector.of("id", 1L)), connect(UniqueSelector.of("id", 2L)))
        .build();

    assertThrows(DirectiveValidationException.class, () -> planner.planUpdate("User", UniqueSelector.of("id", 1L), set));
    assertThrows(DirectiveValidationException.class, () -> planner.planUpdate("Post", UniqueSelector.of("id", 1L), two));
  }

  @Test
  void listUpdateWithoutSelector_isRejected() {
    WriteData data = WriteData.builder().with("posts", update(WriteData.of(Map.of("title", "x")))).build();

    assertThrows(DirectiveValidationException.class, () -> planner.planUpdate("User", UniqueSelector.of("id", 1L), data));
  }

  @Test
  void updateManyWithNestedRelations_isRejected() {
    WriteData nested = WriteData.builder().with("comments", deleteMany(null)).build();
    WriteData data = WriteData.builder().with("posts", updateMany(null, nested)).build();

    assertThrows(DirectiveValidationException.class, () -> planner.planUpdate("User", UniqueSelector.of("id", 1L), data));
  }

  @Test
  void missingRequiredField_isReportedAtItsDirective() {
    WriteData data = WriteData.builder()
        .set("slug", "s").set("title", "T")
        .with("comments", create(WriteData.empty()))
        .build();

    DirectiveValidationException e = assertThrows(DirectiveValidationException.class, () -> planner.planCreate("Post", data));
    assertTrue(e.getMessage().contains("body"));
    assertEquals("Post/comments[0]:create", e.path().toString());
  }

  @Test
  void detachingOrDeletingRequiredSide_isRejected() {
    WriteData disconnect = WriteData.builder().with("comments", disconnect(UniqueSelector.of("id", 1L))).build();
    WriteData delete = WriteData.builder().with("post", WriteDirective.delete(null)).build();

    assertThrows(CardinalityViolationException.class,
        () -> planner.planUpdate("Post", UniqueSelector.of("id", 1L), disconnect));
    assertThrows(CardinalityViolationException.class,
        () -> planner.planUpdate("Comment", UniqueSelector.of("id", 1L), delete));
  }

  @Test
  void unknownFieldOrRelation_isRejected() {
    assertThrows(DirectiveValidationException.class,
        () -> planner.planCreate("User", WriteData.of(Map.of("email", "a@x.io", "nickname", "x"))));
    assertThrows(DirectiveValidationException.class,
        () -> planner.planCreate("User", WriteData.builder().set("email", "a@x.io")
            .with("followers", create(WriteData.empty())).build()));
  }

  private static List<Class<?>> kinds(WritePlan plan) {
    List<Class<?>> out = new ArrayList<>();
    for (PlanStep s : plan.steps()) out.add(s.getClass());
    return out;
  }
}

package io.intellixity.relata.persistence.query;

public enum Clause { AND, OR }

package io.intellixity.semantica.sql.resolve;

public enum FieldKind { DIMENSION, METRIC, NONE }

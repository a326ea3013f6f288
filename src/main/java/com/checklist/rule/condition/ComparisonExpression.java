package com.checklist.rule.condition;

/**
 * Node of a comparison tree.
 */
public sealed interface ComparisonExpression permits ComparisonLeaf, ComparisonJunction {
}

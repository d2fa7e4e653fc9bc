package com.funnelduck.query;

/**
 * A complete query: either a single SELECT or a set operation over queries.
 */
public sealed interface QueryNode permits SelectNode, SetOperationNode {
}

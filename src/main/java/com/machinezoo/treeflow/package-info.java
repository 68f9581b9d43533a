// Part of Treeflow
/*
 * Conventions followed by all runtime classes:
 * - Null check is performed on method parameters where appropriate.
 * - Usage errors (duplicate keys, stale contexts, sinks invoked while rendering, configuration after start) throw IllegalStateException.
 * - Exceptions from observers, debuggers, listeners, and lifetime callbacks are logged and otherwise ignored.
 * - Exceptions from application-defined equals() and equivalence checks are treated as a change.
 * - Metrics and tracing spans are produced only by the host and the side effect registry.
 * - Runtime objects have their OwnerTrace alias and parent set. Their toString() uses OwnerTrace.
 */
/**
 * Runtime for trees of composable stateful workflows.
 */
package com.machinezoo.treeflow;

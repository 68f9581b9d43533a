// Part of Treeflow
/**
 * Diagnostic utilities shared by the runtime.
 */
package com.machinezoo.treeflow.util;

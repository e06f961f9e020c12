/**
 * Internal collection meta operation package.
 *
 * <p>This package defines the closed set of operations the coordinator
 * accepts and the fallible conversion contract that produces them.</p>
 *
 * <h2>Sealed Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.core.operation.CollectionMetaOperation} - Create, Update, Delete, ChangeAliases</li>
 *   <li>{@link com.ryuqq.gateway.core.operation.AliasOperation} - CreateAlias, RenameAlias, DeleteAlias</li>
 *   <li>{@link com.ryuqq.gateway.core.operation.ConversionResult} - Converted or Rejected</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Purity:</strong> conversion performs no I/O and never throws for malformed input</li>
 *   <li><strong>Immutability:</strong> operations are records that live for a single submission</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.core.operation;

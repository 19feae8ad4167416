/**
 * SyncVault source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.syncvault.sync.SyncEngine} replicates one collection to one destination.</li>
 *   <li>{@code io.syncvault.integrity.IntegrityAuditor} fingerprints a source and its replicas.</li>
 *   <li>{@code io.syncvault.integrity.Reconciler} repairs what an audit found.</li>
 *   <li>{@code io.syncvault.runtime.SyncVaultRuntime} wires handlers, persistence and the audit log.</li>
 * </ul>
 */
package io.syncvault;

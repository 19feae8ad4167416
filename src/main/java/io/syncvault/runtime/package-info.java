/**
 * Runtime orchestration package.
 *
 * <p>{@link io.syncvault.runtime.SyncVaultRuntime} is the caller side of the engine: it fans
 * sync runs out over destinations, persists checkpoints, the conflict queue and integrity
 * reports, and resolves queued conflicts.
 */
package io.syncvault.runtime;

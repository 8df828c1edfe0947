/**
 * In-memory caches fed by the event dispatcher and read by the query facade.
 * <p><strong>Concurrency:</strong> Each store synchronizes internally and never calls into another store, so
 * no lock is ever held across stores. Snapshots are copies that callers may read without locking.</p>
 * <p><strong>Performance:</strong> Every operation is in-memory and bounded; nothing blocks on I/O.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.meshgate.application.store;

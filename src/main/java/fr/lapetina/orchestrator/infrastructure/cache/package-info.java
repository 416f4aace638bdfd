/**
 * Context cache.
 *
 * <p>{@link fr.lapetina.orchestrator.infrastructure.cache.ContextCache} memoizes the
 * expensive assembly of an operation context per subject. Entries are validated against a
 * content hash computed by {@link fr.lapetina.orchestrator.infrastructure.cache.ContextHasher},
 * expire after a fixed TTL and are evicted oldest-first when capacity is reached.
 */
package fr.lapetina.orchestrator.infrastructure.cache;

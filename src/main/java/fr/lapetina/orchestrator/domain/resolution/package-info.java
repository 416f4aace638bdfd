/**
 * Provider resolution.
 *
 * <p>{@link fr.lapetina.orchestrator.domain.resolution.ProviderResolver} turns a caller
 * identity into the ordered candidate list of a dispatch, from stored
 * {@link fr.lapetina.orchestrator.domain.resolution.PreferenceStore preferences} or from
 * the environment defaults. No lock is held while the preference store is awaited.
 */
package fr.lapetina.orchestrator.domain.resolution;

package de.prgrm.cypher.ogm.runtime.mapping;

/**
 * @param entity the loaded or newly saved entity
 * @param created {@code true} when the entity did not exist and was saved
 */
public record GetOrCreateResult<T>(T entity, boolean created) {
}

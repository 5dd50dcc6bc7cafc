/**
 * Build project documents as fetched from and posted to a deployment environment.
 *
 * <ul>
 *   <li>{@link com.buildsync.model.SchemaDocument} – classes keyed by environment-local id, each holding
 *       {@link com.buildsync.model.FieldDefinition fields} with {@link com.buildsync.model.ExtractionLine extraction lines}</li>
 *   <li>{@link com.buildsync.model.UdfCatalog} – user-defined functions keyed by id</li>
 *   <li>{@link com.buildsync.model.ValidationDocument} – validation rules and their {@link com.buildsync.model.ValidationKind kind}</li>
 *   <li>{@link com.buildsync.model.BuildJson} – shared mapper, {@code fromJson}/{@code toJson}</li>
 *   <li>{@link com.buildsync.model.Identifiers} – conversion between JSON id values and string keys</li>
 * </ul>
 * Entity bodies are kept as Jackson trees so attributes this model does not name survive a round trip.
 */
package com.buildsync.model;

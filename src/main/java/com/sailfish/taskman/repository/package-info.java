/**
 * Defines the data access layer, {@link com.sailfish.taskman.repository.TaskGateway},
 * responsible for reading and writing rows of the {@code tasks} table.
 * {@link com.sailfish.taskman.repository.JpaTaskGateway} is the JPA implementation.
 */
package com.sailfish.taskman.repository;

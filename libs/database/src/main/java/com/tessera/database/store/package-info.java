/** JDBC implementation of {@link com.tessera.authorization.assignment.AssignmentStore}. */
package com.tessera.database.store;

/** Datasource, Flyway and assignment-store wiring for the authorization database. */
package com.tessera.database.migration;

/**
 * Ingestion scenarios and the suite that runs them against one QuestDB instance.
 */
package io.qdbcompat.suite;

/**
 * Upstream chat capability consumed by diagnosis and reviewing.
 */
package io.crewmesh.llm;

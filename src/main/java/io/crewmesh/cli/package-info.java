/**
 * picocli entry points over {@link io.crewmesh.runtime.CrewMeshRuntime}. Every command prints JSON.
 */
package io.crewmesh.cli;

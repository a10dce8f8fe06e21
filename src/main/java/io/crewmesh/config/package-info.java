/**
 * Data-root layout ({@link io.crewmesh.config.CrewMeshConfig}) and the team settings file.
 */
package io.crewmesh.config;

/**
 * Task execution and review capabilities plugged into the worker loop.
 */
package io.crewmesh.agent;

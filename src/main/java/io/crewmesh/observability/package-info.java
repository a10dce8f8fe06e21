/**
 * Durable JSONL trails for score updates and evolution decisions.
 */
package io.crewmesh.observability;

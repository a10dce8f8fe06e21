/**
 * Persisted records shared by the queue, the mailbox and the reputation layer.
 */
package io.crewmesh.model;

/**
 * Inter-worker messaging.
 *
 * <p>{@link io.crewmesh.bus.Mailbox} carries shutdown requests from the process runtime and
 * review requests between peers.
 */
package io.crewmesh.bus;

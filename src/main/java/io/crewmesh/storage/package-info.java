/**
 * File-backed shared state. Every JSON document is guarded by an {@link io.crewmesh.storage.AdvisoryLock}
 * on a sibling lock file and replaced atomically on write.
 */
package io.crewmesh.storage;

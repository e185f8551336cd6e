/**
 * SQLite persistence for projects, workspaces, locks, permissions and assignments.
 *
 * <p>Every store call runs on a short-lived connection. Writes go through
 * {@link io.timstate.storage.Database#inTransaction}, which opens an immediate transaction or
 * joins the one already bound to the calling thread, so a store method called from inside another
 * store's transaction commits or rolls back with it.
 */
package io.timstate.storage;

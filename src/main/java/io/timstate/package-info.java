/**
 * tim-state source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.timstate.Main} bootstraps the maintenance CLI.</li>
 *   <li>{@code io.timstate.storage.Database} opens the SQLite file, migrates it and runs the one-time legacy import.</li>
 *   <li>The {@code *Store} classes in {@code io.timstate.storage} are the only code that issues SQL for their tables.</li>
 *   <li>{@code io.timstate.legacy.JsonImporter} turns the old JSON files into rows.</li>
 * </ul>
 */
package io.timstate;

package ca.gc.cra.teleq.application.port;

import ca.gc.cra.teleq.application.query.SavedQuery;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Port for the folder of saved {@code .kql} queries that belongs to a workspace.
 * <p><strong>Contract:</strong> reads never create the folder; files without query text are skipped; saving a
 * name that already exists in the category replaces the file.</p>
 *
 * @since 0.1.0
 */
public interface QueryLibrary {

  /**
   * Lists every saved query, subfolders included.
   *
   * @return queries ordered by relative path
   */
  List<SavedQuery> list();

  /**
   * Finds queries matching any of the terms, most relevant first.
   *
   * @param terms search terms; an empty list returns {@link #list()}
   * @return matching queries
   */
  List<SavedQuery> search(List<String> terms);

  /**
   * Looks a query up by display name or file name, ignoring case.
   *
   * @param name display name or file name, with or without the suffix
   * @return first match in {@link #list()} order
   */
  Optional<SavedQuery> find(String name);

  /**
   * Writes a query file.
   *
   * @param draft query to save
   * @return the saved query as it will be read back
   */
  SavedQuery save(Draft draft);

  /**
   * Lists the category folders.
   *
   * @return folder names, sorted
   */
  List<String> categories();

  /**
   * Query to be saved.
   *
   * @param name display name; also the source of the file name
   * @param kql query text
   * @param purpose optional purpose
   * @param useCase optional use case
   * @param tags tags; may be empty
   * @param category optional category folder
   */
  record Draft(String name, String kql, String purpose, String useCase, List<String> tags, String category) {
    public Draft {
      tags = tags == null ? List.of() : List.copyOf(tags);
    }
  }
}

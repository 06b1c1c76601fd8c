package ca.gc.cra.teleq.config;

/**
 * One row of {@code teleq list-profiles}.
 *
 * @param name profile key
 * @param connectionName configured connection name, or the key when unset
 * @param parent profile this one extends; {@code null} when it has none
 * @param isDefault whether the document names this profile as its default
 */
public record ProfileSummary(String name, String connectionName, String parent, boolean isDefault) {}

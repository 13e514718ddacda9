package com.gentoro.tasktree.cache;

/**
 * Restricts a scan to one workspace; {@link #all()} covers the whole corpus.
 *
 * @param workspace workspace key, null for every workspace
 */
public record ScanScope(String workspace) {
  private static final ScanScope ALL = new ScanScope(null);

  public static ScanScope all() {
    return ALL;
  }

  public static ScanScope workspace(String workspace) {
    return workspace == null || workspace.isBlank() ? ALL : new ScanScope(workspace);
  }

  public boolean isAll() {
    return workspace == null;
  }

  public boolean covers(String taskWorkspace) {
    return isAll() || workspace.equals(taskWorkspace);
  }
}

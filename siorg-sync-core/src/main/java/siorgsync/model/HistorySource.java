package siorgsync.model;

/**
 * Origin of a sync history entry.
 */
public enum HistorySource {
  /** Written by the worker when it applied a registry change. */
  SYNC,
  /** Written when an operator resolved a conflict. */
  MANUAL
}

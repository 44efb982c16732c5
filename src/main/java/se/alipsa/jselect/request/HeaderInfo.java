package se.alipsa.jselect.request;

/** How the remote service treats the first line of the object. */
public enum HeaderInfo {
  /** The first line names the columns and is not returned as data. */
  USE,
  /** There is no header line; columns are addressed by position. */
  NONE
}

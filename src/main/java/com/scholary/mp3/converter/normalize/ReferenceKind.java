package com.scholary.mp3.converter.normalize;

/** How a source reference is fetched. */
public enum ReferenceKind {
  /** A known media platform; fetched through the extraction tool. */
  PLATFORM,

  /** Any other http(s) URL; fetched with a plain HTTP GET. */
  DIRECT,

  /** Not something we can fetch. */
  UNSUPPORTED
}

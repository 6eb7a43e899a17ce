package com.example.repoassist;

import lombok.Value;

/** A file or directory to be tagged, with the text the tag is derived from. */
@Value
public class TagSubject {
    String path;
    boolean directory;
    /** File head for files; child names and tags for directories. */
    String content;
}

package com.example.repoassist;

import java.io.IOException;
import java.util.List;

/** Seam over process creation so command-line collaborators can be tested without forking. */
public interface ProcessRunner {
    Process start(List<String> command) throws IOException;
}

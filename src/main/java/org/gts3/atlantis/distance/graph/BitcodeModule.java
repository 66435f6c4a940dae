package org.gts3.atlantis.distance.graph;

import java.nio.file.Path;

/**
 * A compilation unit whose call graph is extracted from its {@code <name>.0.0.*.bc} bitcode file.
 */
public class BitcodeModule {
    private final String name;
    private final Path bitcodeFile;

    public BitcodeModule(String name, Path bitcodeFile) {
        this.name = name;
        this.bitcodeFile = bitcodeFile;
    }

    public String getName() {
        return name;
    }

    public Path getBitcodeFile() {
        return bitcodeFile;
    }

    @Override
    public String toString() {
        return name + " (" + bitcodeFile.getFileName() + ")";
    }
}

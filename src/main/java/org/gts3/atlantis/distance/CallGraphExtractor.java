package org.gts3.atlantis.distance;

import java.nio.file.Path;

import org.gts3.atlantis.distance.graph.BitcodeModule;

/**
 * Dumps the call graph of a bitcode module as a DOT file.
 */
public interface CallGraphExtractor {

    /**
     * Extracts the call graph of a module.
     *
     * @param module The bitcode module
     * @param outputPrefix The prefix of the DOT file to produce
     * @param log The log of the running step, receiving diagnostics of the extraction
     * @return The DOT file that was produced
     * @throws CallGraphExtractionException If this attempt failed
     * @throws ToolNotFoundException If the extraction tool is not installed
     */
    Path extract(BitcodeModule module, Path outputPrefix, StepLog log) throws CallGraphExtractionException;
}

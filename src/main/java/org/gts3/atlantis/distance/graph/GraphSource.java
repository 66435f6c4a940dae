package org.gts3.atlantis.distance.graph;

import java.util.Objects;

/**
 * Where the program-wide call graph comes from: the union of all modules, or the call graph of a
 * single fuzzer binary.
 */
public abstract class GraphSource {

    private GraphSource() {
    }

    public static GraphSource wholeProgram() {
        return new WholeProgram();
    }

    public static GraphSource singleFuzzer(String fuzzerName) {
        return new SingleFuzzer(fuzzerName);
    }

    /**
     * @return A stable description of this source, part of the checkpoint fingerprint
     */
    public abstract String describe();

    /**
     * Union of the call graphs of every module found in the binaries directory.
     */
    public static final class WholeProgram extends GraphSource {
        private WholeProgram() {
        }

        @Override
        public String describe() {
            return "whole-program";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof WholeProgram;
        }

        @Override
        public int hashCode() {
            return WholeProgram.class.hashCode();
        }

        @Override
        public String toString() {
            return "WholeProgram";
        }
    }

    /**
     * The call graph of exactly one fuzzer binary.
     */
    public static final class SingleFuzzer extends GraphSource {
        private final String fuzzerName;

        private SingleFuzzer(String fuzzerName) {
            if (fuzzerName == null || fuzzerName.isBlank()) {
                throw new IllegalArgumentException("Fuzzer name must not be empty");
            }
            this.fuzzerName = fuzzerName;
        }

        public String getFuzzerName() {
            return fuzzerName;
        }

        @Override
        public String describe() {
            return "single-fuzzer:" + fuzzerName;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SingleFuzzer other && fuzzerName.equals(other.fuzzerName);
        }

        @Override
        public int hashCode() {
            return Objects.hash(fuzzerName);
        }

        @Override
        public String toString() {
            return "SingleFuzzer(" + fuzzerName + ")";
        }
    }
}

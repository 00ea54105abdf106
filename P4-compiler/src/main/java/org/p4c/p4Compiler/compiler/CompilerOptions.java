/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.p4c.p4Compiler.compiler;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.ParametersDelegate;

import java.util.HashMap;
import java.util.Map;

/** Options for the P4 middle-end. */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CompilerOptions {
    /** Options that change the generated code. */
    @SuppressWarnings("CanBeFinal")
    public static class Language {
        @Parameter(names = "--tempPrefix", description = "Prefix used for the names of temporary variables")
        public String tempPrefix = "tmp";
        @Parameter(names = "--validate", arity = 1,
                description = "Check that the simplified program contains only simple expressions")
        public boolean validate = true;

        public boolean same(Language language) {
            return this.tempPrefix.equals(language.tempPrefix) &&
                    this.validate == language.validate;
        }

        @Override
        public String toString() {
            return "Language{" +
                    "\n\ttempPrefix=" + this.tempPrefix +
                    ",\n\tvalidate=" + this.validate +
                    '}';
        }
    }

    /** Options related to input and output. */
    @SuppressWarnings("CanBeFinal")
    public static class IO {
        @DynamicParameter(names = "-T",
                description = "Specify logging level for a class (can be repeated)")
        public Map<String, String> loggingLevel = new HashMap<>();
        @Parameter(names = "-v", description = "Output verbosity")
        public int verbosity = 0;

        public boolean same(IO other) {
            return this.verbosity == other.verbosity &&
                    this.loggingLevel.equals(other.loggingLevel);
        }

        /** Throws if some option value cannot be used. */
        public void validate() {
            for (Map.Entry<String, String> entry: this.loggingLevel.entrySet()) {
                try {
                    Integer.parseInt(entry.getValue());
                } catch (NumberFormatException ex) {
                    throw new ParameterException(
                            "-T option must be followed by 'class=number'; could not parse " + entry);
                }
            }
        }

        @Override
        public String toString() {
            return "IO{" +
                    "\n\tloggingLevel=" + this.loggingLevel +
                    ",\n\tverbosity=" + this.verbosity +
                    '}';
        }
    }

    @Parameter(names = {"-h", "--help", "-?"}, help = true, description = "Show this message and exit")
    public boolean help;
    @ParametersDelegate
    public IO ioOptions = new IO();
    @ParametersDelegate
    public Language languageOptions = new Language();

    public CompilerOptions() {}

    public static CompilerOptions getDefault() {
        return new CompilerOptions();
    }

    /** Parse command-line arguments.
     * @throws ParameterException if the arguments are malformed. */
    public static CompilerOptions parse(String... argv) {
        CompilerOptions options = new CompilerOptions();
        JCommander commander = JCommander.newBuilder()
                .addObject(options)
                .build();
        commander.setProgramName("p4-simplify");
        commander.parse(argv);
        options.ioOptions.validate();
        return options;
    }

    public boolean same(CompilerOptions other) {
        if (!this.ioOptions.same(other.ioOptions)) return false;
        return this.languageOptions.same(other.languageOptions);
    }

    @Override
    public String toString() {
        return "CompilerOptions{" +
                "\nhelp=" + this.help +
                ",\nioOptions=" + this.ioOptions +
                ",\nlanguageOptions=" + this.languageOptions +
                "\n}";
    }
}

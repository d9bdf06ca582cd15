/*
 * The MIT License
 *
 * Copyright 2017 Tim Boudreau.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package com.mastfrog.prime.cli;

import com.mastfrog.prime.EratosthenesGenerator;
import com.mastfrog.prime.Generator23;
import com.mastfrog.prime.PrimeGenerator;
import com.mastfrog.prime.Primes;
import com.mastfrog.prime.TrialDivisionGenerator;
import com.mastfrog.settings.Settings;
import com.mastfrog.settings.SettingsBuilder;
import static com.mastfrog.prime.cli.Main.HELP;
import static com.mastfrog.prime.cli.Main.exit;
import com.mastfrog.util.collections.CollectionUtils;
import com.mastfrog.util.preconditions.ConfigurationError;
import java.io.IOException;
import java.math.BigInteger;
import java.util.Map;

/**
 * Lists primes up to a bound, or a fixed number of them.
 *
 * @author Tim Boudreau
 */
public class ListMain {

    static final String MAX_VALUE = "max";
    static final String COUNT = "count";
    static final String GENERATOR = "generator";

    private static final Map<Character, String> SHORT_COMMANDS = CollectionUtils.<Character, String>map('m').to(MAX_VALUE)
            .map('c').to(COUNT)
            .map('g').to(GENERATOR)
            .map('h').to(HELP)
            .build();

    private static final Map<String, String> HELP_COMMANDS = CollectionUtils.<String, String>map(HELP).to("Print this help.")
            .map(MAX_VALUE).to("List primes up to and including this value")
            .map(COUNT).to("List at most this many primes")
            .map(GENERATOR).to("The generator to use: eratosthenes (default), trial, or 23 (which also emits "
                    + "some composites)")
            .buildLinkedHashMap();

    public static void main(String... args) throws IOException {
        try {
            Settings s = new SettingsBuilder("prime-list").parseCommandLineArguments(SHORT_COMMANDS, args).build();
            String max = s.getString(MAX_VALUE);
            long count = s.getLong(COUNT, -1);
            if (s.getBoolean(HELP, false) || (max == null && count < 0)) {
                Main.printHelpAndExit("java -jar prime-cli.jar list --max/-m [n] --count/-c [n] --generator/-g [name]",
                        SHORT_COMMANDS, HELP_COMMANDS,
                        "Prints one prime per line.  At least one of --max and --count is required.");
                return;
            }
            PrimeGenerator generator = generator(s.getString(GENERATOR, "eratosthenes"));
            BigInteger bound = max == null ? null : new BigInteger(max.replace("_", ""));
            Primes.each(bound, generator).stream()
                    .limit(count < 0 ? Long.MAX_VALUE : count)
                    .forEach(System.out::println);
        } catch (ConfigurationError | NumberFormatException err) {
            if (Main.unitTest) {
                throw err;
            }
            exit(10, err instanceof NumberFormatException
                    ? "Not a number - " + err.getMessage()
                    : err.getMessage() + "");
        }
    }

    static PrimeGenerator generator(String name) {
        switch (name.toLowerCase()) {
            case "eratosthenes":
                return new EratosthenesGenerator();
            case "trial":
                return new TrialDivisionGenerator();
            case "23":
                return new Generator23();
            default:
                exit(4, "Unknown generator '" + name + "' - use eratosthenes, trial or 23");
                throw new AssertionError(name);
        }
    }
}

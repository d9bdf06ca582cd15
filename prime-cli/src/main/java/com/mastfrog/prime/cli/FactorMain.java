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

import com.mastfrog.prime.PrimePower;
import com.mastfrog.prime.Primes;
import com.mastfrog.settings.Settings;
import com.mastfrog.settings.SettingsBuilder;
import static com.mastfrog.prime.cli.Main.HELP;
import static com.mastfrog.prime.cli.Main.exit;
import com.mastfrog.util.collections.CollectionUtils;
import com.mastfrog.util.preconditions.ConfigurationError;
import com.mastfrog.util.strings.Strings;
import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Prints the prime factorization of each of a list of numbers.
 *
 * @author Tim Boudreau
 */
public class FactorMain {

    static final String NUMBER = "number";

    private static final Map<Character, String> SHORT_COMMANDS = CollectionUtils.<Character, String>map('n').to(NUMBER)
            .map('h').to(HELP)
            .build();

    private static final Map<String, String> HELP_COMMANDS = CollectionUtils.<String, String>map(HELP).to("Print this help.")
            .map(NUMBER).to("One or more comma-delimited nonzero integers to factor; the list may not "
                    + "start with a negative number, e.g. use 10,-45 rather than -45")
            .buildLinkedHashMap();

    public static void main(String... args) throws IOException {
        try {
            Settings s = new SettingsBuilder("prime-factor").parseCommandLineArguments(SHORT_COMMANDS, args).build();
            String numbers = s.getString(NUMBER);
            if (s.getBoolean(HELP, false) || numbers == null) {
                Main.printHelpAndExit("java -jar prime-cli.jar factor --number/-n [n,n,...]",
                        SHORT_COMMANDS, HELP_COMMANDS,
                        "Prints each number as a product of prime powers, e.g. 360 = 2^3 * 3^2 * 5.  "
                        + "Negative numbers are shown with a factor of -1.");
                return;
            }
            for (BigInteger n : Main.parseNumbers(numbers)) {
                if (n.signum() == 0) {
                    exit(3, "Cannot factor 0 - division by zero");
                    return;
                }
                System.out.println(n + " = " + format(Primes.primeDivision(n)));
            }
        } catch (ArithmeticException ex) {
            exit(11, "Arithmetic failure factoring - " + ex.getMessage());
        } catch (ConfigurationError | NumberFormatException err) {
            if (Main.unitTest) {
                throw err;
            }
            exit(10, err instanceof NumberFormatException
                    ? "Not a number - " + err.getMessage()
                    : err.getMessage() + "");
        }
    }

    static String format(List<PrimePower> factors) {
        if (factors.isEmpty()) {
            return "1";
        }
        List<String> parts = new ArrayList<>(factors.size());
        for (PrimePower pp : factors) {
            parts.add(pp.toString());
        }
        return Strings.join(" * ", parts);
    }
}

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

import com.mastfrog.util.collections.CollectionUtils;
import com.mastfrog.util.strings.Strings;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringTokenizer;

/**
 * Entry point; dispatches to the check, factor and list commands.
 *
 * @author Tim Boudreau
 */
public class Main {

    static boolean unitTest;

    static final String HELP = "help";

    static void exit(int code, String... messages) {
        if (unitTest) {
            throw new Error("Exit " + code + " - " + Strings.join(',', messages));
        }
        for (String s : messages) {
            System.err.println(s);
        }
        System.exit(code);
    }

    private static final Map<String, String> help = CollectionUtils.<String, String>map("check").to("Test whether numbers are prime.")
            .map("factor").to("Print the prime factorization of numbers")
            .map("list").to("Print prime numbers up to a bound, or a number of them")
            .buildLinkedHashMap();

    public static void main(String... args) throws Exception {
        if (args.length == 0) {
            printHelpAndExit();
        }
        String cmd = args[0];
        String[] remainingArgs = new String[args.length - 1];
        System.arraycopy(args, 1, remainingArgs, 0, remainingArgs.length);
        switch (cmd.toLowerCase()) {
            case "check":
                CheckMain.main(remainingArgs);
                break;
            case "factor":
                FactorMain.main(remainingArgs);
                break;
            case "list":
                ListMain.main(remainingArgs);
                break;
            default:
                exit(1, "Unknown command '" + cmd + "'");
        }
    }

    private static void printHelpAndExit() {
        StringBuilder sb = new StringBuilder();
        sb.append("Usage: java -jar prime-cli.jar [COMMAND] -x --whatever\n\nPass a command and --help to see command-specific options.\n\n"
                + "Commands:\n");
        for (Map.Entry<String, String> e : help.entrySet()) {
            sb.append("\t").append(e.getKey()).append("\t").append(e.getValue()).append('\n');
        }
        exit(1, sb.toString());
    }

    static void printHelpAndExit(String usage, Map<Character, String> shortCommands, Map<String, String> helpCommands, String description) {
        Map<String, Character> cmdForKey = CollectionUtils.reverse(shortCommands);
        StringBuilder sb = new StringBuilder("Usage:\n").append(usage).append("\n\n");
        helpCommands.entrySet().forEach((e) -> {
            sb.append("--").append(e.getKey()).append(" -").append(cmdForKey.get(e.getKey())).append('\t').append(formatHelpLine(e.getValue())).append('\n');
        });
        sb.append('\n').append(description);
        exit(1, sb.toString());
    }

    static String formatHelpLine(String s) {
        StringBuilder sb = new StringBuilder("\t");
        StringTokenizer tok = new StringTokenizer(s);
        int chars = 0;
        while (tok.hasMoreTokens()) {
            String t = tok.nextToken();
            if (chars > 40) {
                sb.append("\n\t\t\t");
                chars = 0;
            }
            sb.append(t);
            sb.append(' ');
            chars += t.length() + 1;
        }
        return sb.append('\n').toString();
    }

    /**
     * Parse a comma-delimited list of integers of any size.
     */
    static List<BigInteger> parseNumbers(String value) {
        List<BigInteger> result = new ArrayList<>();
        StringTokenizer tok = new StringTokenizer(value, ", ");
        while (tok.hasMoreTokens()) {
            result.add(new BigInteger(tok.nextToken().replace("_", "")));
        }
        if (result.isEmpty()) {
            throw new NumberFormatException("No numbers in '" + value + "'");
        }
        return result;
    }
}

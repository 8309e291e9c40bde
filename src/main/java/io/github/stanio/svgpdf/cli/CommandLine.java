/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.cli;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Minimal command-line parser for {@code --name value}, {@code --name=value}
 * options and {@code --name} flags.  Arguments following {@code --} are
 * never taken as options.
 */
public class CommandLine {

    private static final String END_OF_OPTIONS = "--";

    private final Map<String, OptionHandler> registry = new HashMap<>();

    private final List<String> arguments = new ArrayList<>();

    public CommandLine() {
        // empty
    }

    /**
     * {@return the positional arguments remaining after parsing the options}
     */
    public List<String> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    public CommandLine acceptFlag(String option, Runnable action) {
        registry.put(option, new OptionHandler(false, Function.identity(), v -> action.run()));
        return this;
    }

    public CommandLine acceptOption(String option, Consumer<? super String> action) {
        return acceptOption(option, action, Function.identity());
    }

    public <T>
    CommandLine acceptOption(String option,
                             Consumer<? super T> action,
                             Function<String, ? extends T> valueMapper) {
        registry.put(option, new OptionHandler(true, valueMapper, action));
        return this;
    }

    public CommandLine parseOptions(String... args) {
        arguments.clear();
        Iterator<String> iter = Arrays.asList(args).iterator();
        while (iter.hasNext()) {
            String param = iter.next();
            if (param.equals(END_OF_OPTIONS)) {
                iter.forEachRemaining(arguments::add);
                break;
            }

            int separator = param.indexOf('=');
            String name = (separator < 0) ? param : param.substring(0, separator);
            OptionHandler handler = registry.get(name);
            if (handler != null) {
                String value = (separator < 0) ? null : param.substring(separator + 1);
                handler.parse(name, value, iter);
            } else if (param.startsWith("--") && param.length() > 2) {
                throw ArgumentException.of(name, "unknown option");
            } else {
                arguments.add(param);
            }
        }
        return this;
    }


    private static class OptionHandler {

        private final boolean hasArg;
        private final Function<String, Object> valueMapper;
        private final Consumer<Object> action;

        @SuppressWarnings("unchecked")
        <T> OptionHandler(boolean hasArg,
                          Function<String, ? extends T> valueMapper,
                          Consumer<? super T> action) {
            this.hasArg = hasArg;
            this.valueMapper = (Function<String, Object>) valueMapper;
            this.action = (Consumer<Object>) action;
        }

        void parse(String option, String value, Iterator<String> args) {
            if (!hasArg) {
                if (value != null)
                    throw new ArgumentException(option + " doesn't accept argument");

                action.accept("");
                return;
            }

            String arg = value;
            if (arg == null) {
                if (!args.hasNext())
                    throw new ArgumentException(option + " requires an argument");

                arg = args.next();
            }
            try {
                action.accept(valueMapper.apply(arg));
            } catch (ArgumentException e) {
                throw e;
            } catch (RuntimeException e) {
                throw ArgumentException.of(option, e);
            }
        }

    } // class OptionHandler


    public CommandLine withMaxArgs(int count) {
        int extraSize = arguments.size() - count;
        if (extraSize > 0) {
            throw new ArgumentException(extraSize + " too many argument(s): "
                    + String.join(" ", arguments.subList(count, arguments.size())));
        }
        return this;
    }

    public String requireArg(int index, String name) {
        return arg(index).orElseThrow(() -> new ArgumentException("Specify " + name));
    }

    public Optional<String> arg(int index) {
        return arguments.size() > index
                ? Optional.of(arguments.get(index))
                : Optional.empty();
    }

    /**
     * Parses a non-negative number.
     */
    public static double nonNegative(String value) {
        double number = Double.parseDouble(value.strip());
        if (!(number >= 0))
            throw new IllegalArgumentException("must not be negative: " + value);

        return number;
    }


    public static class ArgumentException extends RuntimeException {

        private static final long serialVersionUID = 2730562018855431674L;

        public ArgumentException(String message) {
            super(message);
        }

        public ArgumentException(String message, Throwable cause) {
            super(message, cause);
        }

        public static ArgumentException of(String argument, String message) {
            return new ArgumentException(argument + ": " + message);
        }

        public static ArgumentException of(String argument, Throwable cause) {
            return new ArgumentException(argument
                    + ": " + userMessage(cause), cause);
        }

        public static String userMessage(Throwable cause) {
            String message = cause.getMessage();
            String type = cause.getClass().getSimpleName()
                               .replaceFirst("(Runtime)?Exception$", "");
            return type.isEmpty() ? message : type + ": " + message;
        }

    } // class ArgumentException


} // class CommandLine

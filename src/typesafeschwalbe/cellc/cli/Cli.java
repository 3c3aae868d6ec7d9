package typesafeschwalbe.cellc.cli;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import typesafeschwalbe.cellc.compiler.Error;
import typesafeschwalbe.cellc.compiler.Result;

public class Cli {

    private interface Argument {
        char shortName();
        String longName();
        String description();
        String valueDescription();
        boolean hasValue();
        boolean isRequired();
    }

    public static record RequiredArgument(
        char shortName, String longName, String description,
        String valueDescription
    ) implements Argument {
        @Override public boolean hasValue() { return true; }
        @Override public boolean isRequired() { return true; }
    }

    public static record OptionalArgument(
        char shortName, String longName, String description,
        String valueDescription
    ) implements Argument {
        @Override public boolean hasValue() { return true; }
        @Override public boolean isRequired() { return false; }
    }

    public static record Flag(
        char shortName, String longName, String description
    ) implements Argument {
        @Override public boolean hasValue() { return false; }
        @Override public boolean isRequired() { return false; }
        @Override public String valueDescription() { return null; }
    }

    public static final Flag HELP = new Flag(
        'h', "help", "displays a list of all available arguments"
    );


    public static class Values {

        private final Map<RequiredArgument, String> required;
        private final Map<OptionalArgument, Optional<String>> optional;
        private final Map<Flag, Boolean> flags;
        private final List<String> free;

        private Values(
            Map<RequiredArgument, String> required,
            Map<OptionalArgument, Optional<String>> optional,
            Map<Flag, Boolean> flags,
            List<String> free
        ) {
            this.required = required;
            this.optional = optional;
            this.flags = flags;
            this.free = free;
        }

        public String get(RequiredArgument arg) {
            if(!this.required.containsKey(arg)) {
                throw new IllegalArgumentException(
                    "The given argument was not registered!"
                );
            }
            return this.required.get(arg);
        }

        public Optional<String> get(OptionalArgument arg) {
            if(!this.optional.containsKey(arg)) {
                throw new IllegalArgumentException(
                    "The given argument was not registered!"
                );
            }
            return this.optional.get(arg);
        }

        public boolean get(Flag flag) {
            if(!this.flags.containsKey(flag)) {
                throw new IllegalArgumentException(
                    "The given flag was not registered!"
                );
            }
            return this.flags.get(flag);
        }

        public boolean helpRequested() {
            return this.flags.getOrDefault(HELP, false);
        }

        public List<String> free() {
            return this.free;
        }

    }


    private final List<RequiredArgument> required;
    private final List<OptionalArgument> optional;
    private final List<Flag> flags;
    private final Set<String> registered;

    public Cli() {
        this.required = new ArrayList<>();
        this.optional = new ArrayList<>();
        this.flags = new ArrayList<>();
        this.registered = new HashSet<>();
        this.add(HELP);
    }

    private void register(Argument arg) {
        if(this.registered.contains(arg.longName())) {
            throw new IllegalArgumentException(
                "The given argument was already registered!"
            );
        }
        this.registered.add(arg.longName());
    }

    public Cli add(RequiredArgument arg) {
        this.register(arg);
        this.required.add(arg);
        return this;
    }

    public Cli add(OptionalArgument arg) {
        this.register(arg);
        this.optional.add(arg);
        return this;
    }

    public Cli add(Flag flag) {
        this.register(flag);
        this.flags.add(flag);
        return this;
    }

    private static Error argumentError(String message, String arg) {
        return new Error(
            Error.Kind.INVALID_ARGUMENT, message, List.of(arg)
        );
    }

    private static Result<Values> invalidArgument(String arg) {
        return Result.ofError(Cli.argumentError(
            "'" + arg + "' is not a valid argument", arg
        ));
    }

    private static Result<Values> missingValue(String arg) {
        return Result.ofError(Cli.argumentError(
            "'" + arg + "' does not have a value specified", arg
        ));
    }

    private static Error missingArgument(RequiredArgument arg) {
        return Cli.argumentError(
            "The argument "
                + "('--" + arg.longName + "' / '-" + arg.shortName + "')"
                + " [" + arg.valueDescription + "]"
                + " is required but missing",
            "--" + arg.longName
        );
    }

    private Argument lookUpArgument(String longName) {
        for(RequiredArgument arg: this.required) {
            if(arg.longName.equals(longName)) { return arg; }
        }
        for(OptionalArgument arg: this.optional) {
            if(arg.longName.equals(longName)) { return arg; }
        }
        for(Flag arg: this.flags) {
            if(arg.longName.equals(longName)) { return arg; }
        }
        return null;
    }

    private Argument lookUpArgument(char shortName) {
        for(RequiredArgument arg: this.required) {
            if(arg.shortName == shortName) { return arg; }
        }
        for(OptionalArgument arg: this.optional) {
            if(arg.shortName == shortName) { return arg; }
        }
        for(Flag arg: this.flags) {
            if(arg.shortName == shortName) { return arg; }
        }
        return null;
    }

    private static void appendArgumentHelp(Argument arg, StringBuilder out) {
        String value = arg.hasValue()? " <" + arg.valueDescription() + ">" : "";
        out.append("    -").append(arg.shortName()).append(value).append("\n");
        out.append("    --").append(arg.longName()).append(value).append("\n");
        out.append("                ").append(arg.description()).append("\n");
    }

    public String usage() {
        StringBuilder out = new StringBuilder();
        out.append("List of available arguments:\n");
        out.append("Required:\n");
        for(RequiredArgument arg: this.required) {
            Cli.appendArgumentHelp(arg, out);
        }
        out.append("Optional:\n");
        for(OptionalArgument arg: this.optional) {
            Cli.appendArgumentHelp(arg, out);
        }
        for(Flag arg: this.flags) {
            Cli.appendArgumentHelp(arg, out);
        }
        return out.toString();
    }

    public Result<Values> parse(String[] args) {
        Map<RequiredArgument, String> required = new HashMap<>();
        Map<OptionalArgument, Optional<String>> optional = new HashMap<>();
        Map<Flag, Boolean> flags = new HashMap<>();
        List<String> free = new ArrayList<>();
        for(int argIdx = 0; argIdx < args.length; argIdx += 1) {
            String arg = args[argIdx];
            Argument argObj;
            if(arg.startsWith("--")) {
                argObj = this.lookUpArgument(arg.substring(2));
            } else if(arg.startsWith("-") && arg.length() > 1) {
                if(arg.length() > 2) {
                    return Cli.invalidArgument(arg);
                }
                argObj = this.lookUpArgument(arg.charAt(1));
            } else {
                free.add(arg);
                continue;
            }
            if(argObj == null) {
                return Cli.invalidArgument(arg);
            }
            if(argObj.hasValue()) {
                if(argIdx + 1 >= args.length) {
                    return Cli.missingValue(arg);
                }
                String value = args[argIdx + 1];
                argIdx += 1;
                if(argObj.isRequired()) {
                    required.put((RequiredArgument) argObj, value);
                } else {
                    optional.put((OptionalArgument) argObj, Optional.of(value));
                }
            } else {
                flags.put((Flag) argObj, true);
            }
        }
        boolean help = flags.getOrDefault(HELP, false);
        List<Error> missing = new ArrayList<>();
        for(RequiredArgument arg: this.required) {
            if(required.containsKey(arg) || help) {
                continue;
            }
            missing.add(Cli.missingArgument(arg));
        }
        if(!missing.isEmpty()) {
            return Result.ofError(missing);
        }
        for(OptionalArgument arg: this.optional) {
            if(optional.containsKey(arg)) {
                continue;
            }
            optional.put(arg, Optional.empty());
        }
        for(Flag arg: this.flags) {
            if(flags.containsKey(arg)) {
                continue;
            }
            flags.put(arg, false);
        }
        return Result.ofValue(new Values(required, optional, flags, free));
    }

}

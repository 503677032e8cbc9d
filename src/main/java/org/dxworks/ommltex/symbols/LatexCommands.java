package org.dxworks.ommltex.symbols;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Formats registered LaTeX commands as {@code \name{arg1}{arg2}...}.
 */
public final class LatexCommands {

    private static final Map<String, CommandDescriptor> COMMANDS = List.of(
            new CommandDescriptor("sqrt", 1, false),
            new CommandDescriptor("mathbb", 1, true),
            new CommandDescriptor("frac", 2, false),
            new CommandDescriptor("binom", 2, false),
            new CommandDescriptor("neq", 0, true),
            new CommandDescriptor("alpha", 0, true),

            // accents
            new CommandDescriptor("hat", 1, false),
            new CommandDescriptor("tilde", 1, false),
            new CommandDescriptor("bar", 1, false),
            new CommandDescriptor("dot", 1, false),
            new CommandDescriptor("ddot", 1, false),
            new CommandDescriptor("vec", 1, false),

            // decorations
            new CommandDescriptor("overline", 1, false),
            new CommandDescriptor("underline", 1, false),
            new CommandDescriptor("overbrace", 1, false),
            new CommandDescriptor("underbrace", 1, false),
            new CommandDescriptor("boxed", 1, false),
            new CommandDescriptor("overset", 2, false),
            new CommandDescriptor("underset", 2, false),
            new CommandDescriptor("text", 1, false)
    ).stream().collect(Collectors.toUnmodifiableMap(CommandDescriptor::name, Function.identity()));

    private LatexCommands() {}

    public static Optional<CommandDescriptor> descriptor(String name) {
        return Optional.ofNullable(COMMANDS.get(name));
    }

    public static boolean isRegistered(String name) {
        return COMMANDS.containsKey(name);
    }

    /**
     * Formats {@code name} with the given arguments. Unknown commands come back as a bare
     * {@code \name}; missing arguments are left out, surplus ones ignored.
     */
    public static String format(String name, Object... args) {
        CommandDescriptor descriptor = COMMANDS.get(name);
        if (descriptor == null) {
            return "\\" + name;
        }

        StringBuilder sb = new StringBuilder("\\").append(name);
        for (int i = 0; i < descriptor.parameterCount() && i < args.length; i++) {
            sb.append('{').append(args[i] == null ? "" : args[i]).append('}');
        }
        if (descriptor.trailingSpace()) {
            sb.append(' ');
        }
        return sb.toString();
    }
}

package hlsyde.common.architecture;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Entity names end up in generated VHDL, so they must be basic identifiers:
 * a letter first, then letters and digits with single underscores in between,
 * and not a reserved word.
 */
public final class VhdlIdentifiers {

    private static final Pattern BASIC_IDENTIFIER = Pattern.compile("^[A-Za-z](?:_?[A-Za-z0-9])*$");

    private static final Set<String> RESERVED_WORDS = Set.of(
            "abs", "access", "after", "alias", "all", "and", "architecture", "array", "assert", "assume",
            "attribute", "begin", "block", "body", "buffer", "bus", "case", "component", "configuration",
            "constant", "context", "cover", "default", "disconnect", "downto", "else", "elsif", "end", "entity",
            "exit", "fairness", "file", "for", "force", "function", "generate", "generic", "group", "guarded",
            "if", "impure", "in", "inertial", "inout", "is", "label", "library", "linkage", "literal", "loop",
            "map", "mod", "nand", "new", "next", "nor", "not", "null", "of", "on", "open", "or", "others", "out",
            "package", "parameter", "port", "postponed", "procedure", "process", "property", "protected", "pure",
            "range", "record", "register", "reject", "release", "rem", "report", "restrict", "return", "rol",
            "ror", "select", "sequence", "severity", "shared", "signal", "sla", "sll", "sra", "srl", "strong",
            "subtype", "then", "to", "transport", "type", "unaffected", "units", "until", "use", "variable",
            "view", "vmode", "vprop", "vunit", "wait", "when", "while", "with", "xnor", "xor");

    private VhdlIdentifiers() {
    }

    public static boolean isValid(String identifier) {
        return identifier != null
                && BASIC_IDENTIFIER.matcher(identifier).matches()
                && !RESERVED_WORDS.contains(identifier.toLowerCase(Locale.ROOT));
    }
}

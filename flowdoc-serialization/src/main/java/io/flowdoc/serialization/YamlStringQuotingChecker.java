package io.flowdoc.serialization;

import com.fasterxml.jackson.dataformat.yaml.util.StringQuotingChecker;
import java.io.Serial;
import java.util.regex.Pattern;

/// Quotes every string a YAML reader would otherwise resolve to another type.
///
/// The default checker leaves plain scalars such as `.inf`, `0x1F`, `1e3` or `1_000`
/// unquoted, and those read back as numbers or fail to read. This checker also quotes
/// anything matching the YAML 1.1 implicit types: booleans, integers in any base,
/// floats including infinities and NaN, nulls, the merge key and timestamps.
///
/// @implNote Stateless and thread-safe.
final class YamlStringQuotingChecker extends StringQuotingChecker.Default {

    @Serial private static final long serialVersionUID = 2208470631952274417L;

    private static final Pattern IMPLICIT_TYPE =
            Pattern.compile(
                    String.join(
                            "|",
                            // bool
                            "y|Y|yes|Yes|YES|n|N|no|No|NO",
                            "true|True|TRUE|false|False|FALSE",
                            "on|On|ON|off|Off|OFF",
                            // int
                            "[-+]?0b[0-1_]+",
                            "[-+]?0[0-7_]+",
                            "[-+]?0o[0-7_]+",
                            "[-+]?(?:0|[1-9][0-9_]*)",
                            "[-+]?0x[0-9a-fA-F_]+",
                            "[-+]?[1-9][0-9_]*(?::[0-5]?[0-9])+",
                            // float
                            "[-+]?(?:\\.[0-9_]+|[0-9][0-9_]*(?:\\.[0-9_]*)?)(?:[eE][-+]?[0-9]+)?",
                            "[-+]?[0-9][0-9_]*(?::[0-5]?[0-9])+\\.[0-9_]*",
                            "[-+]?\\.(?:inf|Inf|INF)",
                            "\\.(?:nan|NaN|NAN)",
                            // null
                            "~|null|Null|NULL",
                            // merge
                            "<<",
                            // timestamp
                            "[0-9]{4}-[0-9]{1,2}-[0-9]{1,2}(?:(?:[Tt]|[ \\t]+)[0-9]{1,2}:[0-9]{2}:[0-9]{2}"
                                    + "(?:\\.[0-9]*)?(?:[ \\t]*(?:Z|[-+][0-9]{1,2}(?::[0-9]{2})?))?)?"));

    @Override
    public boolean needToQuoteValue(String value) {
        return value.isEmpty()
                || super.needToQuoteValue(value)
                || IMPLICIT_TYPE.matcher(value).matches();
    }
}

package edu.colorado.clear.vn.common.util;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class PropertyUtil {

    /**
     * Loads a UTF-8 properties file and resolves environment variables in its
     * values.
     * @see #resolveEnvironmentVariables(Properties)
     */
    public static Properties load(File file) throws IOException {
        Properties props = new Properties();
        try (Reader in = new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8)) {
            props.load(in);
        }
        return resolveEnvironmentVariables(props);
    }

    /**
     * Filters properties (does not inherit other properties)
     * @see #filterProperties(Properties, String, boolean)
     */
    public static Properties filterProperties(Properties in, String filter) {
        return filterProperties(in, filter, false);
    }

    /**
     * Returns the properties whose names begin with <code>filter</code>, with
     * the prefix removed. If inherit is specified, the other properties are
     * kept as is unless a filtered property has the same name.
     * @param in input properties object
     * @param filter property name prefix
     * @param inherit whether to keep properties that do not begin with the filter
     * @return filtered properties
     */
    public static Properties filterProperties(Properties in, String filter, boolean inherit) {
        Properties out = new Properties();

        for (String propName:in.stringPropertyNames())
            if (propName.startsWith(filter))
                out.setProperty(propName.substring(filter.length()), in.getProperty(propName));

        if (inherit)
            for (String propName:in.stringPropertyNames())
                if (!propName.startsWith(filter) && out.getProperty(propName)==null)
                    out.setProperty(propName, in.getProperty(propName));

        return out;
    }

    // match ${ENV_VAR_NAME}
    static final Pattern ENV_PATTERN = Pattern.compile("\\$\\{(\\w+)\\}");

    /**
     * Returns a new properties object with environment variables in the
     * values resolved. Environment variables are written in the
     * ${ENV_VAR_NAME} form; undefined variables resolve to an empty string.
     */
    public static Properties resolveEnvironmentVariables(Properties in) {
        Properties out = new Properties();

        for (String propName:in.stringPropertyNames()) {
            Matcher m = ENV_PATTERN.matcher(in.getProperty(propName));
            StringBuffer sb = new StringBuffer();
            while (m.find()) {
                String envVarValue = System.getenv(m.group(1));
                m.appendReplacement(sb, envVarValue==null?"":Matcher.quoteReplacement(envVarValue));
            }
            m.appendTail(sb);
            out.setProperty(propName, sb.toString());
        }

        return out;
    }

    public static String toString(Properties props) {
        StringBuilder builder = new StringBuilder();

        String[] keys = props.stringPropertyNames().toArray(new String[0]);
        Arrays.sort(keys);
        for (String key:keys)
            builder.append(key+" = "+props.getProperty(key)+"\n");
        return builder.toString();
    }
}

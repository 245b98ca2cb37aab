package io.cronstore.core.database;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.escape.Escaper;
import com.google.common.net.PercentEscaper;
import com.google.common.net.UrlEscapers;
import io.cronstore.client.config.Config;
import io.cronstore.client.config.ConfigException;

/**
 * PostgreSQL connection string resolved from settings and translated into a
 * JDBC URL plus driver properties.
 *
 * Accepted connection strings are {@code jdbc:postgresql:} URLs,
 * {@code postgres://} URLs (also {@code postgresql://} and {@code pgsql://})
 * and libpq keyword/value strings such as {@code host=db port=5432 dbname=cron}.
 */
public final class PostgresDsn
{
    static final String DEFAULT_HOST = "127.0.0.1";
    static final String DEFAULT_PORT = "5432";
    static final String DEFAULT_USER = "postgres";
    static final String DEFAULT_DATABASE = "postgres";
    static final String DEFAULT_SSLMODE = "disable";

    private static final String JDBC_PREFIX = "jdbc:postgresql:";

    // same set as userinfo encoding of Go's net/url and libpq URIs
    private static final Escaper USERINFO_ESCAPER = new PercentEscaper("-._~$&+,;=", false);

    private static final Pattern PASSWORD_IN_URL = Pattern.compile("(?i)(password=)[^&;]*");

    // libpq keyword -> pgjdbc property
    private static final Map<String, String> PROPERTY_NAMES = ImmutableMap.<String, String>builder()
        .put("connect_timeout", "connectTimeout")
        .put("application_name", "ApplicationName")
        .put("target_session_attrs", "targetServerType")
        .put("keepalives", "tcpKeepAlive")
        .build();

    private final String jdbcUrl;
    private final Map<String, String> properties;

    private PostgresDsn(String jdbcUrl, Map<String, String> properties)
    {
        this.jdbcUrl = jdbcUrl;
        this.properties = ImmutableMap.copyOf(properties);
    }

    public String getJdbcUrl()
    {
        return jdbcUrl;
    }

    /**
     * Driver properties including {@code user} and {@code password}.
     */
    public Map<String, String> getProperties()
    {
        return properties;
    }

    /**
     * JDBC URL with any inline password masked. Credentials taken out of
     * postgres URLs are never part of the JDBC URL.
     */
    public String getMaskedJdbcUrl()
    {
        return maskPassword(jdbcUrl);
    }

    @Override
    public String toString()
    {
        return getMaskedJdbcUrl();
    }

    /**
     * Resolves the connection string from settings in order of {@code dsn},
     * {@code url} and discrete fields.
     */
    public static String resolve(Config settings)
    {
        Optional<String> dsn = DatabaseConfig.getNonEmptyString(settings, "dsn");
        if (dsn.isPresent()) {
            return dsn.get();
        }

        Optional<String> url = DatabaseConfig.getNonEmptyString(settings, "url");
        if (url.isPresent()) {
            return normalizeUrl(url.get());
        }

        String host = DatabaseConfig.getNonEmptyString(settings, "host").or(DEFAULT_HOST);
        String port = resolvePort(settings);
        String user = DatabaseConfig.getNonEmptyString(settings, "user")
            .or(DatabaseConfig.getNonEmptyString(settings, "username"))
            .or(DEFAULT_USER);
        String password = settings.get("password", String.class, "");
        String database = DatabaseConfig.getNonEmptyString(settings, "dbname")
            .or(DatabaseConfig.getNonEmptyString(settings, "database"))
            .or(DEFAULT_DATABASE);
        String sslmode = DatabaseConfig.getNonEmptyString(settings, "sslmode").or(DEFAULT_SSLMODE);

        return "postgres://" +
            USERINFO_ESCAPER.escape(user) + ":" + USERINFO_ESCAPER.escape(password) +
            "@" + host + ":" + port +
            "/" + UrlEscapers.urlPathSegmentEscaper().escape(database) +
            "?sslmode=" + UrlEscapers.urlFormParameterEscaper().escape(sslmode);
    }

    public static String normalizeUrl(String url)
    {
        if (url.startsWith("pgsql://")) {
            return "postgres://" + url.substring("pgsql://".length());
        }
        if (url.startsWith("postgresql://")) {
            return "postgres://" + url.substring("postgresql://".length());
        }
        return url;
    }

    private static String resolvePort(Config settings)
    {
        JsonNode port = settings.get("port", JsonNode.class, null);
        if (port == null) {
            return DEFAULT_PORT;
        }
        if (port.isTextual() && !port.textValue().isEmpty()) {
            return port.textValue();
        }
        if (port.isIntegralNumber() && port.canConvertToLong() && port.longValue() > 0) {
            return Long.toString(port.longValue());
        }
        return DEFAULT_PORT;
    }

    public static PostgresDsn parse(String dsn)
    {
        if (dsn.startsWith(JDBC_PREFIX)) {
            return new PostgresDsn(dsn, ImmutableMap.of());
        }
        String normalized = normalizeUrl(dsn);
        if (normalized.startsWith("postgres://")) {
            return parseUrl(normalized.substring("postgres://".length()));
        }
        if (dsn.contains("://")) {
            throw new ConfigException("Unsupported scheme of PostgreSQL connection URL: " + dsn.substring(0, dsn.indexOf("://")));
        }
        if (dsn.contains("=")) {
            return parseKeywordValue(dsn);
        }
        throw new ConfigException("Invalid PostgreSQL connection string");
    }

    private static PostgresDsn parseUrl(String rest)
    {
        int fragment = rest.indexOf('#');
        if (fragment >= 0) {
            rest = rest.substring(0, fragment);
        }
        String query = "";
        int q = rest.indexOf('?');
        if (q >= 0) {
            query = rest.substring(q + 1);
            rest = rest.substring(0, q);
        }
        String authority = rest;
        String path = "";
        int slash = rest.indexOf('/');
        if (slash >= 0) {
            authority = rest.substring(0, slash);
            path = rest.substring(slash + 1);
        }

        Map<String, String> params = new LinkedHashMap<>();
        String hosts = authority;
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            String userInfo = authority.substring(0, at);
            hosts = authority.substring(at + 1);
            int colon = userInfo.indexOf(':');
            if (colon >= 0) {
                putIfNotEmpty(params, "user", decodeUserInfo(userInfo.substring(0, colon)));
                params.put("password", decodeUserInfo(userInfo.substring(colon + 1)));
            }
            else {
                putIfNotEmpty(params, "user", decodeUserInfo(userInfo));
            }
        }

        for (String pair : Splitter.on('&').omitEmptyStrings().split(query)) {
            int eq = pair.indexOf('=');
            if (eq < 0) {
                params.put(decodeQuery(pair), "");
            }
            else {
                params.put(decodeQuery(pair.substring(0, eq)), decodeQuery(pair.substring(eq + 1)));
            }
        }

        String database = path.isEmpty() ? null : decodeUserInfo(path);
        if (params.containsKey("dbname")) {
            database = params.remove("dbname");
        }
        if (params.containsKey("host")) {
            hosts = joinHosts(params.remove("host"), params.remove("port"));
        }
        return build(hosts, database, params);
    }

    private static PostgresDsn parseKeywordValue(String dsn)
    {
        Map<String, String> params = new LinkedHashMap<>();
        int pos = 0;
        int length = dsn.length();
        while (true) {
            while (pos < length && Character.isWhitespace(dsn.charAt(pos))) {
                pos++;
            }
            if (pos >= length) {
                break;
            }

            int keyStart = pos;
            while (pos < length && dsn.charAt(pos) != '=' && !Character.isWhitespace(dsn.charAt(pos))) {
                pos++;
            }
            String key = dsn.substring(keyStart, pos);
            while (pos < length && Character.isWhitespace(dsn.charAt(pos))) {
                pos++;
            }
            if (pos >= length || dsn.charAt(pos) != '=') {
                throw new ConfigException("Missing '=' after '" + key + "' in PostgreSQL connection string");
            }
            pos++;
            while (pos < length && Character.isWhitespace(dsn.charAt(pos))) {
                pos++;
            }

            StringBuilder value = new StringBuilder();
            if (pos < length && dsn.charAt(pos) == '\'') {
                pos++;
                boolean closed = false;
                while (pos < length) {
                    char c = dsn.charAt(pos++);
                    if (c == '\\' && pos < length) {
                        value.append(dsn.charAt(pos++));
                    }
                    else if (c == '\'') {
                        closed = true;
                        break;
                    }
                    else {
                        value.append(c);
                    }
                }
                if (!closed) {
                    throw new ConfigException("Unterminated quoted value of '" + key + "' in PostgreSQL connection string");
                }
            }
            else {
                while (pos < length && !Character.isWhitespace(dsn.charAt(pos))) {
                    char c = dsn.charAt(pos++);
                    if (c == '\\' && pos < length) {
                        value.append(dsn.charAt(pos++));
                    }
                    else {
                        value.append(c);
                    }
                }
            }
            params.put(key, value.toString());
        }

        String hosts = joinHosts(params.remove("host"), params.remove("port"));
        String database = params.remove("dbname");
        return build(hosts, database, params);
    }

    private static PostgresDsn build(String hosts, String database, Map<String, String> params)
    {
        if (hosts == null || hosts.isEmpty()) {
            hosts = "localhost";
        }
        if (database == null || database.isEmpty()) {
            // libpq defaults the database name to the user name
            database = params.containsKey("user") ? params.get("user") : DEFAULT_DATABASE;
        }

        Map<String, String> properties = new LinkedHashMap<>();
        for (Map.Entry<String, String> pair : params.entrySet()) {
            String name = PROPERTY_NAMES.containsKey(pair.getKey()) ? PROPERTY_NAMES.get(pair.getKey()) : pair.getKey();
            properties.put(name, convertPropertyValue(pair.getKey(), pair.getValue()));
        }

        String jdbcUrl = "jdbc:postgresql://" + hosts + "/" + UrlEscapers.urlPathSegmentEscaper().escape(database);
        return new PostgresDsn(jdbcUrl, properties);
    }

    private static String convertPropertyValue(String keyword, String value)
    {
        switch (keyword) {
        case "keepalives":
            return "0".equals(value) ? "false" : "true";
        case "target_session_attrs":
            switch (value) {
            case "read-write":
            case "primary":
                return "primary";
            case "read-only":
            case "standby":
                return "secondary";
            case "prefer-standby":
                return "preferSecondary";
            default:
                return value;
            }
        default:
            return value;
        }
    }

    private static String joinHosts(String host, String port)
    {
        if (host == null || host.isEmpty()) {
            if (port == null || port.isEmpty()) {
                return null;
            }
            host = "localhost";
        }
        List<String> hostList = Splitter.on(',').trimResults().splitToList(host);
        List<String> portList = (port == null || port.isEmpty())
            ? new ArrayList<>()
            : Splitter.on(',').trimResults().splitToList(port);
        if (portList.size() > 1 && portList.size() != hostList.size()) {
            throw new ConfigException("Number of ports doesn't match number of hosts in PostgreSQL connection string");
        }
        List<String> addresses = new ArrayList<>();
        for (int i = 0; i < hostList.size(); i++) {
            String h = hostList.get(i);
            if (h.contains(":") && !h.startsWith("[")) {
                h = "[" + h + "]";  // IPv6 literal
            }
            if (portList.isEmpty()) {
                addresses.add(h);
            }
            else {
                addresses.add(h + ":" + portList.get(portList.size() == 1 ? 0 : i));
            }
        }
        return Joiner.on(',').join(addresses);
    }

    private static void putIfNotEmpty(Map<String, String> params, String key, String value)
    {
        if (!value.isEmpty()) {
            params.put(key, value);
        }
    }

    private static String decodeUserInfo(String text)
    {
        // '+' is a literal character outside of query strings
        return decodeQuery(text.replace("+", "%2B"));
    }

    private static String decodeQuery(String text)
    {
        try {
            return URLDecoder.decode(text, StandardCharsets.UTF_8);
        }
        catch (IllegalArgumentException ex) {
            throw new ConfigException("Invalid percent-encoding in PostgreSQL connection URL", ex);
        }
    }

    static String maskPassword(String text)
    {
        return PASSWORD_IN_URL.matcher(text).replaceAll("$1***");
    }
}

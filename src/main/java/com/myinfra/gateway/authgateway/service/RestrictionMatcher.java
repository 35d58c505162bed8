package com.myinfra.gateway.authgateway.service;

import io.netty.util.NetUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates API key restrictions against a request.
 * Malformed patterns and ranges never match; they are logged and skipped.
 */
@Slf4j
@Component
public class RestrictionMatcher {

    /**
     * Checks the request referrer against shell-glob patterns.
     * {@code *} matches any run of characters (including {@code /}), {@code ?} a single character
     * and {@code [...]} a character class.
     *
     * @param referrer The request referrer, may be null
     * @param patterns Configured glob patterns
     * @return true if no patterns are configured, or the referrer matches at least one
     */
    public boolean matchesReferrer(String referrer, List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) return true;
        if (referrer == null) return false;

        for (String pattern : patterns) {
            if (pattern == null) continue;

            Optional<Pattern> regex = compileGlob(pattern);
            if (regex.isEmpty()) {
                log.warn("Invalid referrer restriction pattern '{}', skipping", pattern);
                continue;
            }
            if (regex.get().matcher(referrer).matches()) return true;
        }
        return false;
    }

    /**
     * Checks the client IP against single addresses or CIDR ranges.
     * Only IP literals are accepted on either side; host names are treated as malformed and are never resolved.
     *
     * @param ip     The resolved client IP, may be null
     * @param ranges Configured addresses or CIDR ranges
     * @return true if no ranges are configured, or the IP falls inside at least one
     */
    public boolean matchesIp(String ip, List<String> ranges) {
        if (ranges == null || ranges.isEmpty()) return true;
        if (ip == null || ip.isBlank()) return false;

        byte[] address = parseAddress(ip.trim());
        if (address == null) {
            log.debug("Client address '{}' is not an IP literal", ip);
            return false;
        }

        for (String range : ranges) {
            if (range == null || range.isBlank()) continue;

            Optional<IpRange> parsed = IpRange.parse(range.trim());
            if (parsed.isEmpty()) {
                log.warn("Invalid IP restriction '{}', skipping", range);
                continue;
            }
            if (parsed.get().contains(address)) return true;
        }
        return false;
    }

    /**
     * Parses an IP literal. IPv4-mapped IPv6 addresses such as {@code ::ffff:10.0.0.1} come back as
     * their four IPv4 bytes.
     *
     * @param literal IPv4 or IPv6 literal
     * @return Address bytes, or null if the value is not an IP literal
     */
    static byte[] parseAddress(String literal) {
        byte[] bytes = NetUtil.createByteArrayFromIpAddressString(literal);
        if (bytes == null) return null;
        return isIpv4Mapped(bytes) ? Arrays.copyOfRange(bytes, 12, 16) : bytes;
    }

    private static boolean isIpv4Mapped(byte[] bytes) {
        if (bytes.length != 16) return false;
        for (int i = 0; i < 10; i++) {
            if (bytes[i] != 0) return false;
        }
        return bytes[10] == (byte) 0xff && bytes[11] == (byte) 0xff;
    }

    private record IpRange(byte[] network, int prefixLength) {

        static Optional<IpRange> parse(String range) {
            int slash = range.indexOf('/');
            String addressPart = slash < 0 ? range : range.substring(0, slash);

            byte[] raw = NetUtil.createByteArrayFromIpAddressString(addressPart);
            if (raw == null) return Optional.empty();
            byte[] network = parseAddress(addressPart);

            int prefixLength = network.length * 8;
            if (slash >= 0) {
                String prefix = range.substring(slash + 1);
                if (prefix.isEmpty() || prefix.length() > 3 || !prefix.chars().allMatch(c -> c >= '0' && c <= '9')) {
                    return Optional.empty();
                }
                // a mapped range keeps its IPv6 prefix length
                prefixLength = Integer.parseInt(prefix) - (raw.length - network.length) * 8;
                if (prefixLength < 0 || prefixLength > network.length * 8) return Optional.empty();
            }
            return Optional.of(new IpRange(network, prefixLength));
        }

        boolean contains(byte[] address) {
            if (address.length != network.length) return false;

            int fullBytes = prefixLength / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (address[i] != network[i]) return false;
            }

            int remainingBits = prefixLength % 8;
            if (remainingBits == 0) return true;

            int mask = (0xff << (8 - remainingBits)) & 0xff;
            return (address[fullBytes] & mask) == (network[fullBytes] & mask);
        }
    }

    /**
     * Translates a shell glob into an anchored regular expression.
     *
     * @param glob Glob pattern
     * @return The compiled pattern, or empty if the glob is malformed
     */
    static Optional<Pattern> compileGlob(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '\\' -> {
                    if (i + 1 >= glob.length()) return Optional.empty();
                    regex.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
                }
                case '[' -> {
                    int end = classEnd(glob, i);
                    if (end < 0) return Optional.empty();
                    regex.append(toRegexClass(glob.substring(i + 1, end)));
                    i = end;
                }
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }

        try {
            return Optional.of(Pattern.compile(regex.toString(), Pattern.DOTALL));
        } catch (PatternSyntaxException e) {
            return Optional.empty();
        }
    }

    private static int classEnd(String glob, int start) {
        int j = start + 1;
        if (j < glob.length() && (glob.charAt(j) == '!' || glob.charAt(j) == '^')) j++;
        // a leading ']' is a literal member of the class
        if (j < glob.length() && glob.charAt(j) == ']') j++;
        return glob.indexOf(']', j);
    }

    private static String toRegexClass(String body) {
        StringBuilder cls = new StringBuilder("[");
        int k = 0;
        if (!body.isEmpty() && (body.charAt(0) == '!' || body.charAt(0) == '^')) {
            cls.append('^');
            k = 1;
        }
        for (; k < body.length(); k++) {
            char c = body.charAt(k);
            if (c == '\\' || c == '[' || c == ']' || c == '^' || c == '&') {
                cls.append('\\');
            }
            cls.append(c);
        }
        return cls.append(']').toString();
    }
}

package de.htwsaar.assetpipe.server.middleware;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Liste vertrauenswürdiger Proxies aus einzelnen Adressen oder CIDR-Blöcken,
 * z. B. {@code 10.0.0.1, 192.168.0.0/16, ::1}.
 */
public final class TrustedProxies {

    private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");
    private static final Pattern IPV6 = Pattern.compile("[0-9a-fA-F:.]+");

    private record Block(byte[] network, int prefixBits) {

        boolean contains(byte[] address) {
            if (address.length != network.length) return false;
            int fullBytes = prefixBits / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (address[i] != network[i]) return false;
            }
            int rest = prefixBits % 8;
            if (rest == 0) return true;
            int mask = (0xff << (8 - rest)) & 0xff;
            return (address[fullBytes] & mask) == (network[fullBytes] & mask);
        }
    }

    private final List<Block> blocks;

    private TrustedProxies(List<Block> blocks) {
        this.blocks = List.copyOf(blocks);
    }

    public static TrustedProxies none() {
        return new TrustedProxies(List.of());
    }

    /**
     * @param entries Adressen oder CIDR-Blöcke; leere Einträge werden ignoriert
     * @throws IllegalArgumentException bei ungültigen Einträgen
     */
    public static TrustedProxies of(List<String> entries) {
        List<Block> blocks = new ArrayList<>();
        for (String raw : entries) {
            if (raw == null || raw.isBlank()) continue;
            String entry = raw.trim();
            int slash = entry.indexOf('/');
            String address = slash >= 0 ? entry.substring(0, slash) : entry;
            InetAddress parsed = parseLiteral(address)
                    .orElseThrow(() -> new IllegalArgumentException("Invalid trusted proxy: " + entry));
            int maxBits = parsed.getAddress().length * 8;
            int bits = maxBits;
            if (slash >= 0) {
                try {
                    bits = Integer.parseInt(entry.substring(slash + 1));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid prefix length in trusted proxy: " + entry, e);
                }
                if (bits < 0 || bits > maxBits) {
                    throw new IllegalArgumentException("Invalid prefix length in trusted proxy: " + entry);
                }
            }
            blocks.add(new Block(parsed.getAddress(), bits));
        }
        return new TrustedProxies(blocks);
    }

    public boolean contains(String address) {
        if (blocks.isEmpty()) return false;
        Optional<InetAddress> parsed = parseLiteral(address);
        if (parsed.isEmpty()) return false;
        byte[] bytes = parsed.get().getAddress();
        for (Block block : blocks) {
            if (block.contains(bytes)) return true;
        }
        return false;
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    /**
     * Parst ausschließlich IP-Literale; Hostnamen werden nie aufgelöst.
     *
     * @param value IPv4- oder IPv6-Literal, optional in eckigen Klammern
     * @return Adresse oder leer
     */
    public static Optional<InetAddress> parseLiteral(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim();
        if (v.startsWith("[") && v.endsWith("]")) v = v.substring(1, v.length() - 1);
        if (v.isEmpty()) return Optional.empty();

        if (IPV4.matcher(v).matches()) {
            for (String octet : v.split("\\.")) {
                if (Integer.parseInt(octet) > 255) return Optional.empty();
            }
        } else if (!(v.indexOf(':') >= 0 && IPV6.matcher(v).matches())) {
            return Optional.empty();
        }
        try {
            return Optional.of(InetAddress.getByName(v));
        } catch (UnknownHostException e) {
            return Optional.empty();
        }
    }
}

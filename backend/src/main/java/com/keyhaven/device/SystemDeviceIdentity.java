package com.keyhaven.device;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Identity read from JVM system properties and the local host name, with optional overrides.
 */
public class SystemDeviceIdentity implements DeviceIdentity {

    private static final Logger log = LoggerFactory.getLogger(SystemDeviceIdentity.class);

    private final String name;
    private final String platform;
    private final Map<String, String> details;

    public SystemDeviceIdentity(String nameOverride, String platformOverride) {
        String hostName = hostName();
        this.platform = platformOverride != null ? platformOverride : detectPlatform(System.getProperty("os.name"));
        this.name = nameOverride != null ? nameOverride : (hostName != null ? hostName : "Unknown Device");

        Map<String, String> d = new LinkedHashMap<>();
        d.put("os", System.getProperty("os.name"));
        d.put("os_version", System.getProperty("os.version"));
        d.put("arch", System.getProperty("os.arch"));
        d.put("host_name", hostName);
        d.put("java_runtime", System.getProperty("java.runtime.version"));
        this.details = Map.copyOf(withoutNulls(d));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String platform() {
        return platform;
    }

    @Override
    public Map<String, String> details() {
        return details;
    }

    static String detectPlatform(String osName) {
        if (osName == null) {
            return "unknown";
        }
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("mac")) return "macos";
        if (os.contains("win")) return "windows";
        if (os.contains("linux")) return "linux";
        return "unknown";
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Host name unavailable, using generic device name: {}", e.getMessage());
            return null;
        }
    }

    private static Map<String, String> withoutNulls(Map<String, String> map) {
        map.values().removeIf(v -> v == null);
        return map;
    }
}

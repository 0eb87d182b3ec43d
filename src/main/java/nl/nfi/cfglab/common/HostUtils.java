package nl.nfi.cfglab.common;

import java.net.InetAddress;
import java.net.UnknownHostException;

public final class HostUtils {

    // used to name log files, falls back to "localhost" when the host cannot be resolved
    public static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (final UnknownHostException e) {
            return "localhost";
        }
    }
}

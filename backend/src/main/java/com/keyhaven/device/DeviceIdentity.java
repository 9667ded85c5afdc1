package com.keyhaven.device;

import java.util.Map;

/** Describes the machine this agent runs on. */
public interface DeviceIdentity {

    String name();

    /** Lowercase platform tag such as {@code linux}, {@code macos} or {@code windows}. */
    String platform();

    Map<String, String> details();
}

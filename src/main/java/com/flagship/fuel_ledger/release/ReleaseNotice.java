package com.flagship.fuel_ledger.release;

import lombok.Value;

import java.util.List;

/**
 * What the transport broadcasts after a deploy: the running version, what changed,
 * and every known destination.
 */
@Value
public class ReleaseNotice {
    String version;
    String description;
    List<String> targets;
}

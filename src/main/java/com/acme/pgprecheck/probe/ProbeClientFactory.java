package com.acme.pgprecheck.probe;

import com.acme.pgprecheck.PrecheckContext;
import com.acme.pgprecheck.config.PrecheckConfig;

@FunctionalInterface
public interface ProbeClientFactory {
    ProbeClient open(PrecheckContext ctx, String password, PrecheckConfig config);
}

package com.pmmsentinel.engine.api;

import java.time.Duration;

public interface SurveillanceTask {
    String name();

    Duration interval();

    PassResult run();
}

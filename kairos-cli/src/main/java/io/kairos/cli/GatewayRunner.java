package io.kairos.cli;

@FunctionalInterface
public interface GatewayRunner {
    int run(Integer portOverride) throws Exception;
}

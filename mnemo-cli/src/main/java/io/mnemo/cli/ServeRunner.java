package io.mnemo.cli;

@FunctionalInterface
public interface ServeRunner {
    int run(Integer portOverride) throws Exception;
}

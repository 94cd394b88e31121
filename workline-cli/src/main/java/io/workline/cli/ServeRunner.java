package io.workline.cli;

@FunctionalInterface
public interface ServeRunner {
    int run(int port) throws Exception;
}

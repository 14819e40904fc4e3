package eu.toolchain.timer;

public interface Task {
    public void run() throws Exception;
}

package com.dlxretry.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 命令任务负载, 由 CommandTaskHandler 作为子进程执行
 *
 * JSON 示例：
 * {"cmd": "bash", "args": ["-c", "echo hello"], "dir": "/tmp"}
 */
@Data
@NoArgsConstructor
public class Command {

    /** 可执行文件 */
    private String cmd;

    private List<String> args = new ArrayList<>();

    /** 工作目录, 为空继承当前进程 */
    private String dir;

    public static Command of(String cmd, String... args) {
        Command c = new Command();
        c.setCmd(cmd);
        c.setArgs(new ArrayList<>(Arrays.asList(args)));
        return c;
    }

    public static Command bash(String script) {
        return of("bash", "-c", script);
    }

    /** 完整命令行 */
    public List<String> commandLine() {
        List<String> line = new ArrayList<>();
        line.add(cmd);
        if (args != null) {
            line.addAll(args);
        }
        return line;
    }
}

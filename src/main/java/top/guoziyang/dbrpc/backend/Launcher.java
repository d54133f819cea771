package top.guoziyang.dbrpc.backend;

import java.io.IOException;
import java.nio.file.Path;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import top.guoziyang.dbrpc.backend.config.DriverConfig;
import top.guoziyang.dbrpc.backend.driver.DatabaseDriver;
import top.guoziyang.dbrpc.backend.server.Server;
import top.guoziyang.dbrpc.backend.utils.Panic;
import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;

/**
 * 驱动进程启动器
 *
 * 启动流程：
 * 1. 解析命令行参数，-config指定的properties文件先加载，其余选项覆盖
 * 2. 设置日志文件路径（必须在第一次获取Logger之前）
 * 3. 打开数据库，创建驱动引擎
 * 4. 注册关闭钩子：停止服务器、回滚未完成事务、关闭连接
 * 5. 启动服务器，在主线程里接受连接
 *
 * 使用示例：
 * java Launcher -db /data/code.db -socket /tmp/code-db.sock -workers 10
 * java Launcher -config driver.properties -log /var/log/dbrpc/driver.log
 */
public class Launcher {

    public static void main(String[] args) {
        Options options = options();

        CommandLine cmd;
        try {
            CommandLineParser parser = new DefaultParser();
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("launcher", options);
            return;
        }

        DriverConfig config;
        try {
            config = parseConfig(cmd);
            config.validate();
        } catch (DriverException | IllegalStateException e) {
            System.err.println(e.getMessage());
            new HelpFormatter().printHelp("launcher", options);
            return;
        }
        if (config.getLogFile() != null) {
            System.setProperty("dbrpc.log.file", config.getLogFile().toString());
        }
        run(config);
    }

    static Options options() {
        Options options = new Options();
        options.addOption("config", true, "-config driver.properties");
        options.addOption("db", true, "-db DBPath");
        options.addOption("socket", true, "-socket SocketPath");
        options.addOption("workers", true, "-workers 10");
        options.addOption("queue", true, "-queue 1000");
        options.addOption("timeout", true, "-timeout 30000 (ms)");
        options.addOption("lockTimeout", true, "-lockTimeout 30000 (ms)");
        options.addOption("backupDir", true, "-backupDir BackupPath");
        options.addOption("log", true, "-log LogFile");
        return options;
    }

    static DriverConfig parseConfig(CommandLine cmd) {
        DriverConfig config = cmd.hasOption("config")
            ? DriverConfig.load(Path.of(cmd.getOptionValue("config")))
            : new DriverConfig();
        if (cmd.hasOption("db")) {
            config.setDatabasePath(Path.of(cmd.getOptionValue("db")));
        }
        if (cmd.hasOption("socket")) {
            config.setSocketPath(Path.of(cmd.getOptionValue("socket")));
        }
        if (cmd.hasOption("workers")) {
            config.setWorkers(parseInt(cmd, "workers"));
        }
        if (cmd.hasOption("queue")) {
            config.setQueueMaxSize(parseInt(cmd, "queue"));
        }
        if (cmd.hasOption("timeout")) {
            config.setRequestTimeoutMillis(parseLong(cmd, "timeout"));
        }
        if (cmd.hasOption("lockTimeout")) {
            config.setLockTimeoutMillis(parseLong(cmd, "lockTimeout"));
        }
        if (cmd.hasOption("backupDir")) {
            config.setBackupDir(Path.of(cmd.getOptionValue("backupDir")));
        }
        if (cmd.hasOption("log")) {
            config.setLogFile(Path.of(cmd.getOptionValue("log")));
        }
        return config;
    }

    private static int parseInt(CommandLine cmd, String option) {
        long value = parseLong(cmd, option);
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException e) {
            throw DriverException.of(ErrorCode.INVALID_PARAMS, "-" + option + " is out of range: " + value);
        }
    }

    private static long parseLong(CommandLine cmd, String option) {
        String value = cmd.getOptionValue(option);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw DriverException.of(ErrorCode.INVALID_PARAMS,
                "-" + option + " must be a number: " + value);
        }
    }

    private static void run(DriverConfig config) {
        Logger log = LoggerFactory.getLogger(Launcher.class);
        DatabaseDriver driver = null;
        try {
            driver = DatabaseDriver.open(config, null);
        } catch (DriverException e) {
            Panic.panic(e);
        }
        Server server = new Server(config, driver);
        DatabaseDriver opened = driver;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            server.stop();
            opened.close();
        }, "dbrpc-shutdown"));
        try {
            server.start();
        } catch (IOException e) {
            Panic.panic(e);
        }
    }
}

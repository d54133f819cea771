package top.guoziyang.dbrpc.transport;

import java.io.IOException;

/**
 * 数据包装器 - 组合传输器和编码器，提供Package级别的传输接口
 *
 * 设计思想：
 * 实现Facade（外观）设计模式，上层只和Package打交道：
 * Package -> Encoder -> byte[] -> Transporter -> 网络 -> Transporter -> byte[] -> Encoder -> Package
 *
 * send是同步方法，同一个连接上不会出现两帧交错写出的情况。
 *
 * @see Transporter 底层传输
 * @see Encoder 数据编码
 */
public class Packager {
    private final Transporter transporter;
    private final Encoder encoder;

    public Packager(Transporter transporter, Encoder encoder) {
        this.transporter = transporter;
        this.encoder = encoder;
    }

    /**
     * 发送Package数据包
     *
     * @param pkg 要发送的Package数据包
     * @throws IOException 网络传输异常
     */
    public synchronized void send(Package pkg) throws IOException {
        // 将Package编码为字节数组
        byte[] data = encoder.encode(pkg);

        // 通过网络传输器发送数据
        transporter.send(data);
    }

    /**
     * 接收Package数据包，阻塞直到收到完整的一帧
     *
     * @return 接收到的Package数据包
     * @throws IOException 网络传输异常
     * @throws top.guoziyang.dbrpc.common.DriverException 帧格式错误或连接已关闭
     */
    public Package receive() throws IOException {
        // 从网络接收字节数据
        byte[] data = transporter.receive();

        // 将字节数据解码为Package对象
        return encoder.decode(data);
    }

    public boolean isOpen() {
        return transporter.isOpen();
    }

    /**
     * 关闭数据包装器，释放底层连接
     *
     * @throws IOException 关闭网络资源时的异常
     */
    public void close() throws IOException {
        transporter.close();
    }
}

package top.guoziyang.dbrpc.transport;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.Error;
import top.guoziyang.dbrpc.common.ErrorCode;

/**
 * 网络传输器 - 负责客户端与驱动进程之间的底层数据传输
 *
 * 功能概述：
 * - 封装Unix域套接字通道（SocketChannel）的读写
 * - 提供字节数组的发送和接收功能
 * - 使用十六进制编码确保数据传输安全
 * - 采用行式协议简化解析
 *
 * 协议特点：
 * - 基于行的文本协议（Line-based Protocol），每条消息一行，以\n结束
 * - 十六进制编码避免二进制数据里出现分隔符
 * - 单帧解码后最大16 MiB，超出直接判定为帧错误，不会无限制地读下去
 * - 简单易调试，可以用socat等工具手工测试
 *
 * 线程模型：
 * 直接使用通道的read/write，读写各自有独立的锁，
 * 所以一个线程阻塞在receive时，另一个线程仍然可以close，
 * 阻塞的读会立刻以AsynchronousCloseException返回。客户端的超时看门狗依赖这一点。
 *
 * @see SocketChannel Unix域套接字通道
 * @see Hex Apache Commons编解码工具
 */
public class Transporter {

    /**
     * 单帧解码后的最大字节数
     */
    public static final int MAX_FRAME_BYTES = 16 * 1024 * 1024;

    /**
     * 一行十六进制文本的最大字符数（每字节两个字符）
     */
    private static final int MAX_LINE_CHARS = MAX_FRAME_BYTES * 2;

    private final SocketChannel channel;

    /**
     * 读缓冲区，始终处于"读模式"（flip之后）
     */
    private final ByteBuffer readBuffer;

    private final Object writeLock = new Object();

    public Transporter(SocketChannel channel) {
        this.channel = channel;
        this.readBuffer = ByteBuffer.allocate(8192);
        this.readBuffer.flip();
    }

    /**
     * 连接到指定路径上的Unix域套接字
     *
     * @param socketPath 驱动进程监听的套接字文件
     * @throws IOException 套接字不存在或拒绝连接
     */
    public static Transporter connect(Path socketPath) throws IOException {
        SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX);
        try {
            channel.connect(UnixDomainSocketAddress.of(socketPath));
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        return new Transporter(channel);
    }

    /**
     * 发送字节数组数据
     *
     * 发送流程：
     * 1. 将字节数组编码为十六进制字符串，末尾加换行符
     * 2. 循环写入通道直到全部写完
     *
     * @param data 要发送的字节数组
     * @throws IOException 网络传输异常
     * @throws DriverException MALFORMED_FRAME，数据超过单帧上限
     */
    public void send(byte[] data) throws IOException {
        if (data.length > MAX_FRAME_BYTES) {
            throw Error.FrameTooLargeException;
        }
        ByteBuffer buf = ByteBuffer.wrap(hexEncode(data).getBytes(StandardCharsets.US_ASCII));
        synchronized (writeLock) {
            while (buf.hasRemaining()) {
                channel.write(buf);
            }
        }
    }

    /**
     * 接收一帧数据
     *
     * 接收流程：
     * 1. 从通道读取直到遇到\n
     * 2. 对端在帧之间关闭：抛出ConnectionClosedException
     * 3. 对端在帧中间关闭、长度超限、十六进制非法：抛出MALFORMED_FRAME
     * 4. 将十六进制字符串解码为字节数组
     *
     * @return 接收到的字节数组
     * @throws IOException 网络异常
     */
    public byte[] receive() throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        while (true) {
            if (!readBuffer.hasRemaining()) {
                readBuffer.clear();
                int n = channel.read(readBuffer);
                readBuffer.flip();
                if (n < 0) {
                    // 对端关闭连接，清理本地资源
                    close();
                    if (line.size() == 0) {
                        throw Error.ConnectionClosedException;
                    }
                    throw DriverException.of(ErrorCode.MALFORMED_FRAME, "Connection closed inside a frame");
                }
                continue;
            }
            byte b = readBuffer.get();
            if (b == '\n') {
                break;
            }
            if (line.size() >= MAX_LINE_CHARS) {
                throw Error.FrameTooLargeException;
            }
            line.write(b);
        }
        return hexDecode(new String(line.toByteArray(), StandardCharsets.US_ASCII));
    }

    public boolean isOpen() {
        return channel.isOpen();
    }

    /**
     * 关闭传输器，释放通道
     *
     * 可以在任意线程调用，正在阻塞的读写会被唤醒并抛出异常。
     *
     * @throws IOException 关闭资源时的IO异常
     */
    public void close() throws IOException {
        channel.close();
    }

    /**
     * 编码规则：小写十六进制，每字节两个字符，加换行符作为行结束标记
     */
    private String hexEncode(byte[] buf) {
        return Hex.encodeHexString(buf, true) + "\n";
    }

    private byte[] hexDecode(String buf) {
        try {
            return Hex.decodeHex(buf);
        } catch (DecoderException e) {
            throw DriverException.wrap(ErrorCode.MALFORMED_FRAME, "Invalid hex frame", e);
        }
    }
}

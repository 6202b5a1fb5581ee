package storie.runtime;

/**
 * 帧时钟：维护每帧都会更新的全局变量
 *
 * <ul>
 *   <li>{@code frame}：帧计数（int），初始为 0，第一次 tick 后为 1</li>
 *   <li>{@code dt}：上一帧到本帧的秒数（float）</li>
 *   <li>{@code screenWidth} / {@code screenHeight}：画布尺寸（int）</li>
 * </ul>
 *
 * <pre>
 * FrameClock clock = new FrameClock(runtime, 800, 600);
 * while (running) {
 *     clock.tick(1.0 / 60);
 *     runtime.triggerEvent("render");
 * }
 * </pre>
 */
public final class FrameClock {

    public static final String FRAME = "frame";
    public static final String DT = "dt";
    public static final String SCREEN_WIDTH = "screenWidth";
    public static final String SCREEN_HEIGHT = "screenHeight";

    private final StorieRuntime runtime;
    private long frame = 0;
    private double elapsed = 0.0;

    public FrameClock(StorieRuntime runtime, long width, long height) {
        this.runtime = runtime;
        resize(width, height);
        runtime.setGlobalInt(FRAME, 0);
        runtime.setGlobalFloat(DT, 0.0);
    }

    public void resize(long width, long height) {
        runtime.setGlobalInt(SCREEN_WIDTH, width);
        runtime.setGlobalInt(SCREEN_HEIGHT, height);
    }

    /**
     * 前进一帧，更新 frame 与 dt
     */
    public void tick(double deltaSeconds) {
        if (deltaSeconds < 0) {
            throw new IllegalArgumentException("delta must not be negative: " + deltaSeconds);
        }
        frame++;
        elapsed += deltaSeconds;
        runtime.setGlobalInt(FRAME, frame);
        runtime.setGlobalFloat(DT, deltaSeconds);
    }

    /** 已经前进的帧数，尚未 tick 时为 0 */
    public long getFrame() {
        return frame;
    }

    /** 累计经过的秒数 */
    public double getElapsed() {
        return elapsed;
    }
}

package cn.gm.light.lscan.core;

/**
 * @author 明溪
 * @version 1.0
 * @project logScanner
 * @description TODO
 * @date 2025/4/3 13:31:50
 */
public interface LifeCycle {

    void init();

    void start();

    void stop();
}

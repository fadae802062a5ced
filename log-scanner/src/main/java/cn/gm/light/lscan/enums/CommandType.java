package cn.gm.light.lscan.enums;

/**
 * @author 明溪
 * @version 1.0
 * @project logScanner
 * @description 日志服务支持的请求类型
 * @date 2025/4/3 14:00:02
 */
public enum CommandType {
    GET_ENTRIES,
    GET_TREE_SIZE,
}

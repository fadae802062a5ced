package cn.gm.light.lscan.entity;

import cn.gm.light.lscan.enums.CommandType;
import lombok.Data;

import java.io.Serializable;

/**
 * @author 明溪
 * @version 1.0
 * @project logScanner
 * @description TODO
 * @date 2025/4/3 14:02:11
 */
@Data
public class RequestCommand implements Serializable {
    private static final long serialVersionUID = 1L;
    private CommandType commandType;
    private long start;
    private long end;

    public static RequestCommand getEntries(long start, long end) {
        RequestCommand request = new RequestCommand();
        request.setCommandType(CommandType.GET_ENTRIES);
        request.setStart(start);
        request.setEnd(end);
        return request;
    }

    public static RequestCommand getTreeSize() {
        RequestCommand request = new RequestCommand();
        request.setCommandType(CommandType.GET_TREE_SIZE);
        return request;
    }
}

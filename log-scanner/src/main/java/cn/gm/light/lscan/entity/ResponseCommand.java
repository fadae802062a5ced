package cn.gm.light.lscan.entity;

import lombok.Data;

import java.io.Serializable;

/**
 * @author 明溪
 * @version 1.0
 * @project logScanner
 * @description TODO
 * @date 2025/4/3 14:05:37
 */
@Data
public class ResponseCommand implements Serializable {
    private static final long serialVersionUID = 1L;
    private Boolean success;
    private Integer code;
    private String msg;
    private Object data;

    public static ResponseCommand ok(Object data) {
        ResponseCommand response = new ResponseCommand();
        response.setSuccess(true);
        response.setCode(200);
        response.setMsg("success");
        response.setData(data);
        return response;
    }

    public static ResponseCommand error(Integer code, String msg) {
        ResponseCommand response = new ResponseCommand();
        response.setSuccess(false);
        response.setCode(code);
        response.setMsg(msg);
        return response;
    }

    public boolean isOk() {
        return Boolean.TRUE.equals(success);
    }
}

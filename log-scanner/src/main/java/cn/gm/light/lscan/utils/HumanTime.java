package cn.gm.light.lscan.utils;

/**
 * 把秒数格式化成 "1 hours 2 minutes 3 seconds " 这样的可读文本
 */
public final class HumanTime {

    private HumanTime() {
    }

    public static String format(long seconds) {
        if (seconds < 0) {
            seconds = 0;
        }
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;
        StringBuilder sb = new StringBuilder();
        if (hours > 0) {
            sb.append(hours).append(" hours ");
        }
        if (minutes > 0) {
            sb.append(minutes).append(" minutes ");
        }
        if (secs > 0) {
            sb.append(secs).append(" seconds ");
        }
        return sb.toString();
    }

    public static String formatMillis(long millis) {
        return format(millis / 1000);
    }
}

package buaa.search.crawler;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.Locale;
import java.util.Optional;

/**
 * URL 解析与同源判断
 */
public final class UrlResolver {

    private UrlResolver() {
    }

    /**
     * 将引用解析为绝对地址，去掉片段标识，空路径补为 "/"
     *
     * @param baseUrl 页面地址
     * @param reference href/src 原值
     * @return 绝对地址；无法解析时为空
     */
    public static Optional<String> resolve(String baseUrl, String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        try {
            URL absolute = new URL(new URL(baseUrl), reference.trim());
            String external = withRootPath(absolute);
            int fragmentStart = external.indexOf('#');
            return Optional.of(fragmentStart >= 0 ? external.substring(0, fragmentStart) : external);
        } catch (MalformedURLException e) {
            return Optional.empty();
        }
    }

    /**
     * 是否为 http/https 地址
     */
    public static boolean isHttp(String url) {
        String scheme = schemeOf(url);
        return "http".equals(scheme) || "https".equals(scheme);
    }

    /**
     * 协议、主机（忽略大小写）与端口（缺省端口按协议补齐）都相同
     */
    public static boolean isSameOrigin(String first, String second) {
        try {
            URL a = new URL(first);
            URL b = new URL(second);
            return a.getProtocol().equalsIgnoreCase(b.getProtocol())
                && a.getHost().equalsIgnoreCase(b.getHost())
                && effectivePort(a) == effectivePort(b);
        } catch (MalformedURLException e) {
            return false;
        }
    }

    /**
     * 地址路径部分（小写），用于扩展名判断
     */
    public static String lowerCasePath(String url) {
        try {
            return new URL(url).getPath().toLowerCase(Locale.ROOT);
        } catch (MalformedURLException e) {
            return "";
        }
    }

    /**
     * http://host 与 http://host/ 视为同一地址
     */
    private static String withRootPath(URL url) {
        String external = url.toExternalForm();
        if (url.getAuthority() == null || !url.getPath().isEmpty()) {
            return external;
        }
        String prefix = url.getProtocol() + "://" + url.getAuthority();
        return external.startsWith(prefix)
            ? prefix + "/" + external.substring(prefix.length())
            : external;
    }

    private static String schemeOf(String url) {
        try {
            return new URL(url).getProtocol().toLowerCase(Locale.ROOT);
        } catch (MalformedURLException e) {
            return "";
        }
    }

    private static int effectivePort(URL url) {
        return url.getPort() != -1 ? url.getPort() : url.getDefaultPort();
    }
}

package buaa.search.crawler;

import buaa.search.config.SearchEngineProperties;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 页面内容抽取
 *
 * <p>从已解析的页面中抽取可见文本、图片、音频与同源出链。
 * 纯函数，不访问网络与存储；所有相对引用都以页面地址为基准解析为绝对地址。</p>
 */
@Component
public class FragmentExtractor {

    private static final Logger log = LoggerFactory.getLogger(FragmentExtractor.class);

    private final Set<String> ignoredTextTags;
    private final List<String> imageExtensions;
    private final List<String> audioExtensions;

    public FragmentExtractor(SearchEngineProperties properties) {
        SearchEngineProperties.Crawler crawler = properties.getCrawler();
        this.ignoredTextTags = lowerCased(crawler.getIgnoredTextTags());
        this.imageExtensions = new ArrayList<>(lowerCased(crawler.getImageExtensions()));
        this.audioExtensions = new ArrayList<>(lowerCased(crawler.getAudioExtensions()));
    }

    /**
     * 抽取页面内容
     *
     * @param document 已解析的页面
     * @param pageUrl 页面地址
     * @return 抽取结果
     */
    public PageFragments extract(Document document, String pageUrl) {
        List<String> texts = extractTexts(document);
        Set<ImageAsset> images = extractImages(document, pageUrl);
        Set<AudioAsset> audios = extractAudios(document, pageUrl);
        Set<String> links = extractLinks(document, pageUrl);
        log.debug("页面抽取完成: {}, 文本 {}, 图片 {}, 音频 {}, 链接 {}",
            pageUrl, texts.size(), images.size(), audios.size(), links.size());
        return new PageFragments(texts, images, audios, links);
    }

    /**
     * 按文档顺序收集 body 下的文本节点，跳过脚本、样式等结构性标签
     */
    List<String> extractTexts(Document document) {
        Element body = document.body();
        if (body == null) {
            return List.of();
        }
        List<String> texts = new ArrayList<>();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (!(node instanceof TextNode)) {
                    return;
                }
                Node parent = node.parent();
                if (parent instanceof Element
                        && ignoredTextTags.contains(((Element) parent).normalName())) {
                    return;
                }
                String text = ((TextNode) node).getWholeText().strip();
                if (!text.isEmpty()) {
                    texts.add(text);
                }
            }
        }, body);
        return texts;
    }

    Set<ImageAsset> extractImages(Document document, String pageUrl) {
        Set<ImageAsset> images = new LinkedHashSet<>();
        for (Element img : document.select("img[src]")) {
            resolveMedia(pageUrl, img.attr("src"), imageExtensions)
                .ifPresent(url -> images.add(new ImageAsset(url, img.attr("alt"))));
        }
        return images;
    }

    Set<AudioAsset> extractAudios(Document document, String pageUrl) {
        Set<AudioAsset> audios = new LinkedHashSet<>();
        for (Element audio : document.select("audio[src], audio source[src]")) {
            resolveMedia(pageUrl, audio.attr("src"), audioExtensions)
                .ifPresent(url -> audios.add(new AudioAsset(url)));
        }
        return audios;
    }

    Set<String> extractLinks(Document document, String pageUrl) {
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.attr("href");
            Optional<String> resolved = UrlResolver.resolve(pageUrl, href);
            if (resolved.isEmpty()) {
                log.debug("忽略无法解析的链接: {}", href);
                continue;
            }
            String link = resolved.get();
            if (UrlResolver.isHttp(link) && UrlResolver.isSameOrigin(pageUrl, link)) {
                links.add(link);
            }
        }
        return links;
    }

    private Optional<String> resolveMedia(String pageUrl, String src, List<String> extensions) {
        return UrlResolver.resolve(pageUrl, src)
            .filter(UrlResolver::isHttp)
            .filter(url -> hasExtension(url, extensions));
    }

    private boolean hasExtension(String url, List<String> extensions) {
        String path = UrlResolver.lowerCasePath(url);
        for (String extension : extensions) {
            if (path.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> lowerCased(List<String> values) {
        return values.stream()
            .map(value -> value.toLowerCase(Locale.ROOT))
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}

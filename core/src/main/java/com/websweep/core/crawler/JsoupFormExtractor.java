package com.websweep.core.crawler;

import com.websweep.core.model.Form;
import com.websweep.core.model.FormInput;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * form → {action, method, inputs}. input/textarea/select 중 name 있는 것만.
 * select 값은 selected option(없으면 첫 option).
 */
public class JsoupFormExtractor implements FormExtractor {

    @Override
    public List<Form> extract(Document doc, URI pageUrl) {
        List<Form> out = new ArrayList<>();
        if (doc == null) return out;

        for (Element form : doc.select("form")) {
            out.add(toForm(form, pageUrl));
        }
        return out;
    }

    /** form 요소 하나 변환(요소 속성을 함께 봐야 하는 체크에서 사용) */
    public static Form toForm(Element form, URI pageUrl) {
        List<FormInput> inputs = new ArrayList<>();
        for (Element in : form.select("input, textarea, select")) {
            String name = in.attr("name");
            if (name.isEmpty()) continue;
            switch (in.normalName()) {
                case "textarea" -> inputs.add(new FormInput(name, "textarea", in.text()));
                case "select" -> inputs.add(new FormInput(name, "select", selectValue(in)));
                default -> inputs.add(new FormInput(name, in.attr("type"), in.attr("value")));
            }
        }
        return new Form(resolveAction(form, pageUrl), form.attr("method"), inputs);
    }

    /* --- 헬퍼 --- */

    private static String resolveAction(Element form, URI pageUrl) {
        String raw = form.attr("action").trim();
        String page = (pageUrl == null ? "" : pageUrl.toString());
        if (raw.isEmpty()) return page;
        String abs = form.attr("abs:action");
        if (!abs.isBlank()) return abs;
        try {
            return pageUrl == null ? raw : pageUrl.resolve(raw.replace(" ", "%20")).toString();
        } catch (IllegalArgumentException e) {
            return page;
        }
    }

    private static String selectValue(Element select) {
        Element opt = select.selectFirst("option[selected]");
        if (opt == null) opt = select.selectFirst("option");
        if (opt == null) return "";
        return opt.hasAttr("value") ? opt.attr("value") : opt.text();
    }
}

package com.example.epubgloss.service.annotation;

import com.example.epubgloss.dto.AnnotationReport;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Annotates every fragment of a document and attaches the matching stylesheet once.
 */
@Service
public class DocumentAnnotationService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentAnnotationService.class);

    private static final String WRAPPER_SELECTOR = "." + AnnotationStylesheet.WRAPPER_CLASS;

    @Autowired
    private AnnotationEngine annotationEngine;

    public DocumentAnnotationService() {
    }

    public DocumentAnnotationService(AnnotationEngine annotationEngine) {
        this.annotationEngine = annotationEngine;
    }

    public AnnotationReport annotate(AnnotatableDocument document) {
        AnnotationReport report = new AnnotationReport();

        for (String id : document.fragmentIds()) {
            Element fragment = document.fragment(id);
            int before = fragment.select(WRAPPER_SELECTOR).size();

            annotationEngine.process(fragment);

            int added = fragment.select(WRAPPER_SELECTOR).size() - before;
            report.setFragmentsProcessed(report.getFragmentsProcessed() + 1);
            if (added > 0) {
                document.replaceFragment(id, fragment);
                report.setFragmentsModified(report.getFragmentsModified() + 1);
                report.setWordsAnnotated(report.getWordsAnnotated() + added);
            }
            logger.debug("Processed fragment {} ({} words annotated)", id, added);
        }

        document.attachStylesheet(AnnotationStylesheet.forStyle(annotationEngine.getStyle()));

        logger.info("Annotated {} words in {} of {} fragments ({} style)",
                   report.getWordsAnnotated(), report.getFragmentsModified(),
                   report.getFragmentsProcessed(), annotationEngine.getStyle());
        return report;
    }
}

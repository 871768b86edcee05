package io.github.reugn.snapshot4j.processor;

import javax.annotation.processing.Messager;
import javax.lang.model.element.Element;
import javax.tools.Diagnostic;

/**
 * Reports processor diagnostics against source elements.
 */
interface ErrorReporter {

    /**
     * Reports an error on the given element. Compilation fails once processing ends.
     *
     * @param element the element where the error occurred
     * @param message the error message
     */
    void error(Element element, String message);

    /**
     * Reports a warning on the given element.
     *
     * @param element the element the warning refers to
     * @param message the warning message
     */
    void warning(Element element, String message);

    static ErrorReporter of(Messager messager) {
        return new ErrorReporter() {
            @Override
            public void error(Element element, String message) {
                messager.printMessage(Diagnostic.Kind.ERROR, message, element);
            }

            @Override
            public void warning(Element element, String message) {
                messager.printMessage(Diagnostic.Kind.WARNING, message, element);
            }
        };
    }
}

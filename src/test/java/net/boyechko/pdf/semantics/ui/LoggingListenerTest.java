/*
 * PDF-Semantics - Accessible roles and MathML from tagged PDFs
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.semantics.ui;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import net.boyechko.pdf.semantics.core.NodeSemantics;
import net.boyechko.pdf.semantics.core.SemanticsReport;
import net.boyechko.pdf.semantics.math.MathEncoding;
import net.boyechko.pdf.semantics.math.MathMarkup;
import net.boyechko.pdf.semantics.role.RoleInfo;
import net.boyechko.pdf.semantics.role.SemanticRole;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingListenerTest {
    private final Logger logger =
            (Logger) LoggerFactory.getLogger("net.boyechko.pdf.semantics.processing");
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
    }

    @Test
    void formulasAndSummaryAreLogged() {
        NodeSemantics resolved =
                new NodeSemantics(
                        "Document[0].Formula[0]",
                        "Formula",
                        "Formula",
                        1,
                        2,
                        RoleInfo.of(SemanticRole.MATH),
                        new MathMarkup("<math><mn>1</mn></math>", MathEncoding.EMBEDDED_MATHML),
                        0);
        NodeSemantics unresolved =
                new NodeSemantics(
                        "Document[0].Formula[1]",
                        "Formula",
                        "Formula",
                        1,
                        3,
                        RoleInfo.of(SemanticRole.MATH),
                        null,
                        0);

        LoggingListener listener = LoggingListener.withConsoleOutput();
        listener.onPhaseStart("Formulas");
        listener.onFormula(resolved);
        listener.onFormula(unresolved);
        listener.onSummary(new SemanticsReport(List.of(resolved, unresolved), true));

        List<String> messages =
                appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
        assertEquals(
                List.of(
                        "PHASE Formulas",
                        "FORMULA Document[0].Formula[0] (embedded MathML): <math><mn>1</mn></math>",
                        "FORMULA Document[0].Formula[1] has no MathML",
                        "SUMMARY elements=2 classified=2 formulas=2 unresolved=1"),
                messages);
    }

    @Test
    void consoleAppenderIsAddedOnce() {
        LoggingListener.withConsoleOutput();
        LoggingListener.withConsoleOutput();

        Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        assertNotNull(root.getAppender("SEMANTICS_CONSOLE"));
    }
}

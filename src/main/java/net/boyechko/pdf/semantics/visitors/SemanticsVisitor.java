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
package net.boyechko.pdf.semantics.visitors;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.boyechko.pdf.semantics.core.NodeSemantics;
import net.boyechko.pdf.semantics.document.PageNavigator;
import net.boyechko.pdf.semantics.dom.DomAccessException;
import net.boyechko.pdf.semantics.math.MathMarkup;
import net.boyechko.pdf.semantics.math.MathReconstructor;
import net.boyechko.pdf.semantics.role.RoleClassifier;
import net.boyechko.pdf.semantics.role.RoleInfo;
import net.boyechko.pdf.semantics.role.SemanticRole;
import net.boyechko.pdf.semantics.walk.StructureTreeVisitor;
import net.boyechko.pdf.semantics.walk.VisitorContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies every structure element and reconstructs MathML for formulas. Formulas are leaves:
 * their children are never visited.
 *
 * <p>To locate pages, register this visitor as the document context's {@link PageNavigator}; the
 * page shown by {@code scrollIntoView()} is recorded for the current element.
 */
public class SemanticsVisitor implements StructureTreeVisitor, PageNavigator {
    private static final Logger logger = LoggerFactory.getLogger(SemanticsVisitor.class);

    private final MathReconstructor reconstructor;
    private final boolean locatePages;
    private final List<NodeSemantics> nodes = new ArrayList<>();
    private int shownPage;

    public SemanticsVisitor(MathReconstructor reconstructor, boolean locatePages) {
        this.reconstructor = reconstructor;
        this.locatePages = locatePages;
    }

    @Override
    public String name() {
        return "Semantic Roles";
    }

    @Override
    public void beforeTraversal() {
        nodes.clear();
    }

    @Override
    public boolean enterElement(VisitorContext ctx) {
        Optional<RoleInfo> role = RoleClassifier.classify(ctx.stdName());
        boolean isFormula = role.map(r -> r.is(SemanticRole.MATH)).orElse(false);

        MathMarkup math = null;
        if (isFormula) {
            math = reconstructor.reconstruct(ctx.element()).orElse(null);
            if (math != null) {
                logger.debug("{}: MathML from {}", ctx.path(), math.encoding().label());
            } else {
                logger.debug("{}: no MathML recovered", ctx.path());
            }
        }

        int page = locatePages ? locate(ctx) : 0;
        nodes.add(
                new NodeSemantics(
                        ctx.path(),
                        ctx.tag(),
                        ctx.stdName(),
                        ctx.depth(),
                        ctx.globalIndex(),
                        role.orElse(null),
                        math,
                        page));
        return !isFormula;
    }

    @Override
    public void showPage(int pageNumber) {
        shownPage = pageNumber;
    }

    public List<NodeSemantics> getNodes() {
        return List.copyOf(nodes);
    }

    private int locate(VisitorContext ctx) {
        shownPage = 0;
        try {
            ctx.element().scrollIntoView();
        } catch (DomAccessException e) {
            logger.debug("{}: {}", ctx.path(), e.getMessage());
        }
        return shownPage;
    }
}

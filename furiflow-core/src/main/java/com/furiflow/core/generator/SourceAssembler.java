package com.furiflow.core.generator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Assembles the single application source unit.
 *
 * <p>Section order: file banner, sorted include directives, app-state struct,
 * forward declarations, callbacks, cleanup function, entry point. The include
 * set is sorted so that identical inputs always produce identical text.
 */
class SourceAssembler {

    static final List<String> BASE_INCLUDES = List.of(
        "#include <furi.h>",
        "#include <gui/gui.h>",
        "#include <input/input.h>",
        "#include <stdlib.h>"
    );

    private static final String INDENT = "    ";

    private final String appName;
    private final String entryPoint;
    private final Set<Capability> capabilities;

    /**
     * @param appName application id used as C identifier prefix
     * @param entryPoint entry point function name
     * @param capabilities required capabilities, iterated in table order
     */
    SourceAssembler(String appName, String entryPoint, Set<Capability> capabilities) {
        this.appName = appName;
        this.entryPoint = entryPoint;
        this.capabilities = capabilities;
    }

    /**
     * Renders the source unit.
     *
     * @param flowCode expanded code of each entry flow, in discovery order
     * @return complete source text
     */
    String assemble(List<String> flowCode) {
        StringBuilder sb = new StringBuilder();
        sb.append("/**\n * ").append(appName).append(" application\n */\n\n");
        appendIncludes(sb);
        sb.append('\n');
        appendStateStruct(sb);
        sb.append('\n');
        appendForwardDeclarations(sb);
        sb.append('\n');
        appendRenderCallback(sb);
        sb.append('\n');
        appendInputCallback(sb);
        sb.append('\n');
        appendCleanup(sb);
        sb.append('\n');
        appendEntryPoint(sb, flowCode);
        return sb.toString();
    }

    SortedSet<String> includes() {
        SortedSet<String> includes = new TreeSet<>(BASE_INCLUDES);
        capabilities.forEach(c -> includes.addAll(c.includes()));
        return includes;
    }

    private void appendIncludes(StringBuilder sb) {
        includes().forEach(include -> sb.append(include).append('\n'));
    }

    private void appendStateStruct(StringBuilder sb) {
        sb.append("/**\n * Application state structure\n */\n");
        sb.append("typedef struct {\n");
        line(sb, 1, "ViewPort* view_port;");
        line(sb, 1, "Gui* gui;");
        for (Capability capability : capabilities) {
            capability.stateFields().forEach(field -> line(sb, 1, field));
        }
        line(sb, 1, "struct {");
        line(sb, 2, "// Variables will be added here");
        line(sb, 1, "} variables;");
        sb.append("} ").append(stateType()).append(";\n");
    }

    private void appendForwardDeclarations(StringBuilder sb) {
        sb.append("static void ").append(appName).append("_render_callback(Canvas* canvas, void* ctx);\n");
        sb.append("static void ").append(appName).append("_input_callback(InputEvent* event, void* ctx);\n");
    }

    private void appendRenderCallback(StringBuilder sb) {
        sb.append("static void ").append(appName).append("_render_callback(Canvas* canvas, void* ctx) {\n");
        line(sb, 1, "furi_assert(ctx);");
        line(sb, 1, stateType() + "* app = ctx;");
        line(sb, 1, "UNUSED(app);");
        sb.append('\n');
        line(sb, 1, "canvas_clear(canvas);");
        line(sb, 1, "canvas_set_font(canvas, FontPrimary);");
        line(sb, 1, "canvas_draw_str(canvas, 0, 10, \"" + appName + "\");");
        sb.append("}\n");
    }

    private void appendInputCallback(StringBuilder sb) {
        sb.append("static void ").append(appName).append("_input_callback(InputEvent* event, void* ctx) {\n");
        line(sb, 1, "furi_assert(ctx);");
        line(sb, 1, stateType() + "* app = ctx;");
        line(sb, 1, "UNUSED(app);");
        sb.append('\n');
        line(sb, 1, "if(event->type == InputTypePress) {");
        line(sb, 2, "// Handle button press");
        line(sb, 1, "}");
        sb.append("}\n");
    }

    private void appendCleanup(StringBuilder sb) {
        sb.append("static void ").append(appName).append("_free(void* p) {\n");
        line(sb, 1, stateType() + "* app = (" + stateType() + "*)p;");

        List<Capability> reversed = new ArrayList<>(capabilities);
        Collections.reverse(reversed);
        List<String> closes = reversed.stream().flatMap(c -> c.cleanupCode().stream()).toList();
        if (!closes.isEmpty()) {
            sb.append('\n');
            line(sb, 1, "// Close records");
            closes.forEach(statement -> line(sb, 1, statement));
        }

        sb.append('\n');
        line(sb, 1, "// Free view port");
        line(sb, 1, "view_port_enabled_set(app->view_port, false);");
        line(sb, 1, "gui_remove_view_port(app->gui, app->view_port);");
        line(sb, 1, "view_port_free(app->view_port);");
        line(sb, 1, "furi_record_close(RECORD_GUI);");
        sb.append('\n');
        line(sb, 1, "// Free app state");
        line(sb, 1, "free(app);");
        sb.append("}\n");
    }

    private void appendEntryPoint(StringBuilder sb, List<String> flowCode) {
        sb.append("/**\n * Application entry point\n */\n");
        sb.append("int32_t ").append(entryPoint).append("(void* p) {\n");
        line(sb, 1, "UNUSED(p);");
        sb.append('\n');
        line(sb, 1, "// Allocate app state");
        line(sb, 1, stateType() + "* app = malloc(sizeof(" + stateType() + "));");
        sb.append('\n');
        line(sb, 1, "// Initialize view port");
        line(sb, 1, "app->view_port = view_port_alloc();");
        line(sb, 1, "view_port_draw_callback_set(app->view_port, " + appName + "_render_callback, app);");
        line(sb, 1, "view_port_input_callback_set(app->view_port, " + appName + "_input_callback, app);");
        sb.append('\n');
        line(sb, 1, "// Open GUI and register view port");
        line(sb, 1, "app->gui = furi_record_open(RECORD_GUI);");
        line(sb, 1, "gui_add_view_port(app->gui, app->view_port, GuiLayerFullscreen);");

        List<String> inits = capabilities.stream().flatMap(c -> c.initCode().stream()).toList();
        if (!inits.isEmpty()) {
            sb.append('\n');
            line(sb, 1, "// Open records");
            inits.forEach(statement -> line(sb, 1, statement));
        }

        for (String code : flowCode) {
            if (code.isBlank()) {
                continue;
            }
            sb.append('\n');
            for (String codeLine : code.stripTrailing().split("\n", -1)) {
                if (codeLine.isBlank()) {
                    sb.append('\n');
                } else {
                    line(sb, 1, codeLine);
                }
            }
        }

        sb.append('\n');
        line(sb, 1, "// Main application loop");
        line(sb, 1, "view_port_enabled_set(app->view_port, true);");
        sb.append('\n');
        line(sb, 1, "// Wait until the user exits the application");
        line(sb, 1, "while(1) {");
        line(sb, 2, "furi_delay_ms(100);");
        line(sb, 1, "}");
        sb.append('\n');
        line(sb, 1, "// Cleanup");
        line(sb, 1, appName + "_free(app);");
        sb.append('\n');
        line(sb, 1, "return 0;");
        sb.append("}\n");
    }

    private String stateType() {
        return appName + "_state_t";
    }

    private static void line(StringBuilder sb, int depth, String text) {
        sb.append(INDENT.repeat(depth)).append(text).append('\n');
    }
}

package io.formulaxform.core.engine;

/** Fixed text of the generated units: prologue, function headers, banners and epilogue. */
final class SourceTemplates {

    static final String TAB = "  ";

    static final String RULE = "/*----------------------------------------------------------------------------*/\n";

    static final String FILE_HEADER = RULE
            + "/*\n"
            + "  This file is generated by formula-xform from user-defined formulas.\n"
            + "*/\n"
            + RULE
            + "\n"
            + "#include \"cs_defs.h\"\n"
            + "\n"
            + "/*----------------------------------------------------------------------------\n"
            + " * Standard C library headers\n"
            + " *----------------------------------------------------------------------------*/\n"
            + "\n"
            + "#include <assert.h>\n"
            + "#include <math.h>\n"
            + "\n"
            + "#if defined(HAVE_MPI)\n"
            + "#include <mpi.h>\n"
            + "#endif\n"
            + "\n"
            + "/*----------------------------------------------------------------------------\n"
            + " *  Local headers\n"
            + " *----------------------------------------------------------------------------*/\n"
            + "\n"
            + "#include \"cs_headers.h\"\n"
            + "\n";

    static final String LINKAGE_OPEN = RULE + "\nBEGIN_C_DECLS\n\n" + RULE + "\n";

    static final String FILE_FOOTER = "}\n\n" + RULE + "\nEND_C_DECLS\n\n";

    static final String VOLUME_FUNCTION_HEADER = "void\n"
            + "cs_meg_volume_function(cs_field_t              *f,\n"
            + "                       const cs_volume_zone_t  *vz)\n"
            + "{\n";

    static final String BOUNDARY_FUNCTION_HEADER = "cs_real_t *\n"
            + "cs_meg_boundary_function(const char               *field_name,\n"
            + "                         const char               *condition,\n"
            + "                         const cs_boundary_zone_t *bz)\n"
            + "{\n"
            + "  cs_real_t *new_vals = NULL;\n"
            + "\n";

    static final String BOUNDARY_RETURN = TAB + "return new_vals;\n";

    /** Separator line drawn between volume blocks. */
    static final String VOLUME_RULE = TAB + "/*" + "-".repeat(74) + "*/\n";

    static final String VOLUME_CELL_CENTERS =
            "const cs_real_3_t *xyz = (cs_real_3_t *)cs_glob_mesh_quantities->cell_cen;";

    static final String BOUNDARY_FACE_CENTERS =
            "const cs_real_3_t *xyz = (cs_real_3_t *)cs_glob_mesh_quantities->b_face_cog;";

    private SourceTemplates() {}

    static String indent(int depth) {
        return TAB.repeat(depth);
    }

    /** Banner preceding a volume block. */
    static String volumeBanner(String entityName, String zone) {
        return VOLUME_RULE
                + "\n"
                + TAB
                + "/* User defined formula for variable " + entityName + " over zone " + zone + " */\n"
                + "\n";
    }

    /** Boundary banner title, framed above and below by a dashed rule of the same width. */
    static String boundaryTitle(String fieldName, String zone) {
        return "User defined formula for \"" + fieldName + "\" over BC=" + zone;
    }

    static String boundaryRule(String title) {
        return TAB + "/* " + "-".repeat(title.length()) + " */\n";
    }

    /** Escapes text for use inside a C string literal. */
    static String cString(String text) {
        StringBuilder out = new StringBuilder(text.length() + 2);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\':
                    out.append("\\\\");
                    break;
                case '"':
                    out.append("\\\"");
                    break;
                case '\n':
                    out.append("\\n");
                    break;
                case '\t':
                    out.append("\\t");
                    break;
                default:
                    out.append(c);
            }
        }
        return out.toString();
    }
}

package com.initialone.jmayaff.rewrite;

import com.initialone.jmayaff.config.FlagTables;
import com.initialone.jmayaff.config.FormatterConfig;
import com.initialone.jmayaff.config.ModuleImport;
import com.initialone.jmayaff.lexer.SourceSyntaxException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FlagFormatterTest {

    private final FlagFormatter formatter = new FlagFormatter(new FormatterConfig(FlagTables.bundled("2018")));

    @Test
    void format_shouldRewriteNestedCallsAndLeaveOtherCallsAlone() throws Exception {
        String src = "\n"
                + "from maya import cmds\n"
                + "f = (\n"
                + "    \"hahha\"\n"
                + ")\n"
                + "\n"
                + "cmds.delete(\n"
                + "    source,\n"
                + "    ch=function(hi=\"help\"),\n"
                + "    at =cmds.trim(n = \"hello\")\n"
                + ")\n";
        String expected = "\n"
                + "from maya import cmds\n"
                + "f = (\n"
                + "    \"hahha\"\n"
                + ")\n"
                + "\n"
                + "cmds.delete(\n"
                + "    source,\n"
                + "    constructionHistory=function(hi=\"help\"),\n"
                + "    attribute =cmds.trim(name = \"hello\")\n"
                + ")\n";

        assertEquals(expected, formatter.formatString(src));
    }

    @Test
    void format_shouldNotTouchCommentedOutCalls() throws Exception {
        String src = "\nfrom maya import cmds\n#cmds.delete(source, ch=function(hi=\"help\"))\n";
        assertEquals(src, formatter.formatString(src));
    }

    @Test
    void format_shouldRewriteAroundTrailingComments() throws Exception {
        String src = "\n"
                + "from maya import cmds as fgh\n"
                + "fgh.cMuscleWeightPrune(\n"
                + "    pr=True, # cmds.delete(source, ch=function(hi=\"help\"))\n"
                + "    wt=3\n"
                + ")\n";
        String expected = "\n"
                + "from maya import cmds as fgh\n"
                + "fgh.cMuscleWeightPrune(\n"
                + "    prune=True, # cmds.delete(source, ch=function(hi=\"help\"))\n"
                + "    weight=3\n"
                + ")\n";

        assertEquals(expected, formatter.formatString(src));
    }

    @Test
    void format_shouldNotTouchCallsInsideStrings() throws Exception {
        String src = "\n"
                + "from maya import cmds\n"
                + "'''\n"
                + "#\n"
                + "cmds.delete(source, ch=function(hi=\"help\"))\n"
                + "'''\n";
        assertEquals(src, formatter.formatString(src));
    }

    @Test
    void format_shouldFollowImportAlias() throws Exception {
        String src = "\nimport maya.cmds as taco\ntaco.textureWindow(source, itn=\"t\")\n";
        assertEquals("\nimport maya.cmds as taco\ntaco.textureWindow(source, imageToTextureNumber=\"t\")\n",
                formatter.formatString(src));
    }

    @Test
    void format_shouldRequireFullDottedPathForPlainImport() throws Exception {
        String src = "\n"
                + "import maya.asdf\n"
                + "import maya.cmds\n"
                + "from abc import cmds\n"
                + "cmds.volumeBind(q=True)\n"
                + "maya.cmds.textureWindow(source, ra=\"t\")\n";
        String expected = "\n"
                + "import maya.asdf\n"
                + "import maya.cmds\n"
                + "from abc import cmds\n"
                + "cmds.volumeBind(q=True)\n"
                + "maya.cmds.textureWindow(source, removeAllImages=\"t\")\n";

        assertEquals(expected, formatter.formatString(src));
    }

    @Test
    void format_shouldRewriteCallsNestedInArgumentTuples() throws Exception {
        String src = "\n"
                + "from maya import cmds as abc\n"
                + "\n"
                + "abc.textureWindow(source, ra=(\n"
                + "    abc.about(ppc=True),\n"
                + "    abc.about(li=True),\n"
                + "))\n";
        String expected = "\n"
                + "from maya import cmds as abc\n"
                + "\n"
                + "abc.textureWindow(source, removeAllImages=(\n"
                + "    abc.about(macOSppc=True),\n"
                + "    abc.about(linux=True),\n"
                + "))\n";

        assertEquals(expected, formatter.formatString(src));
    }

    @Test
    void format_shouldFailOnPython2Source() {
        String src = "\n"
                + "from maya import cmds as abc\n"
                + "print \"hello\"\n"
                + "\n"
                + "abc.textureWindow(source, ra=(\n"
                + "    abc.about(ppc=True),\n"
                + "))\n";

        SourceSyntaxException e = assertThrows(SourceSyntaxException.class, () -> formatter.format(src, "legacy.py"));
        assertEquals(3, e.getLine());
        assertEquals("legacy.py", e.getFileName());
    }

    @Test
    void format_shouldRejectInvalidStatementsBetweenCalls() {
        for (String middle : List.of("x = (1 +)\n", "a = = b\n", "for in x:\n    pass\n")) {
            String src = "from maya import cmds\n" + middle + "cmds.delete(ch=1)\n";

            SourceSyntaxException e = assertThrows(SourceSyntaxException.class, () -> formatter.format(src, "bad.py"));
            assertEquals(2, e.getLine(), middle);
        }
    }

    @Test
    void format_shouldRewriteAroundNewerPythonSyntax() throws Exception {
        String src = "from maya import cmds\n"
                + "\ud835\udc65 = 1\n"
                + "y = 1if \ud835\udc65 else 2\n"
                + "s = f\"{d[\"k\"]}\"; cmds.delete(ch=1)\n";

        assertEquals("from maya import cmds\n"
                + "\ud835\udc65 = 1\n"
                + "y = 1if \ud835\udc65 else 2\n"
                + "s = f\"{d[\"k\"]}\"; cmds.delete(constructionHistory=1)\n", formatter.formatString(src));
    }

    @Test
    void format_shouldHonourCustomModules() throws Exception {
        FlagFormatter custom = new FlagFormatter(new FormatterConfig(FlagTables.latest(),
                List.of(ModuleImport.parse("ABC.maya2:abc"))));
        String src = "\nfrom ABC.maya2 import abc\n\nabc.textureWindow(source, ra=True)\n";

        assertEquals("\nfrom ABC.maya2 import abc\n\nabc.textureWindow(source, removeAllImages=True)\n",
                custom.formatString(src));
    }

    @Test
    void format_shouldGiveSameResultForEveryAliasForm() throws Exception {
        String body = ".polyCube(n='box', w=2, ch=False)\n";
        String expected = ".polyCube(name='box', width=2, constructionHistory=False)\n";

        assertEquals("from maya import cmds\ncmds" + expected, formatter.formatString("from maya import cmds\ncmds" + body));
        assertEquals("import maya.cmds as mc\nmc" + expected, formatter.formatString("import maya.cmds as mc\nmc" + body));
        assertEquals("import maya.cmds\nmaya.cmds" + expected, formatter.formatString("import maya.cmds\nmaya.cmds" + body));
        assertEquals("import pymel.core as pm\npm" + expected, formatter.formatString("import pymel.core as pm\npm" + body));
    }

    @Test
    void format_shouldBeIdempotent() throws Exception {
        String src = "from maya import cmds\n"
                + "def build():\n"
                + "    cube = cmds.polyCube(n='c', w=1, h=2)[0]\n"
                + "    cmds.xform(cube, q=True, ws=True, t=True)\n"
                + "    cmds.delete(cube, ch=True)\n";

        String once = formatter.formatString(src);
        assertNotEquals(src, once);
        assertEquals(once, formatter.formatString(once));
    }

    @Test
    void format_shouldReportEditCount_andLeaveFilesWithoutTargetImportAlone() throws Exception {
        FormatResult r = formatter.format("import maya.cmds as mc\nmc.ls(sl=True, l=True, zz=1)\n", "a.py");
        assertTrue(r.isChanged());
        assertEquals(2, r.editCount);
        assertEquals("import maya.cmds as mc\nmc.ls(selection=True, long=True, zz=1)\n", r.after);

        String untouched = "import os\ncmds.ls(sl=True)\n";
        FormatResult none = formatter.format(untouched, "b.py");
        assertFalse(none.isChanged());
        assertEquals(0, none.editCount);
        assertSame(untouched, none.after);
    }

    @Test
    void format_shouldKeepCrlfLineEndings() throws Exception {
        String src = "from maya import cmds\r\ncmds.ls(\r\n    sl=True)\r\n";
        assertEquals("from maya import cmds\r\ncmds.ls(\r\n    selection=True)\r\n", formatter.formatString(src));
    }
}

package sast.processor;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.tools.Diagnostic.Kind;

import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

/**
 * Generates the visitor API for the statement AST.
 *
 * <p>For every {@link ASTNode} class {@code Foo} this writes {@code Foo_ASTNode}, an interface with
 * {@code accept} and a {@code visitChildren} that visits each {@link ASTChild} accessor in
 * declaration order. Once all nodes are known it writes {@code ASTVisitor}, {@code
 * DefaultASTVisitor} and {@code VoidDefaultASTVisitor} with one {@code visit} overload per node.
 */
@AutoService(Processor.class)
public class ASTVisitorProcessor extends AbstractProcessor {

  private static final String AST_PACKAGE = "sast";

  private static final ClassName AST_NODE_INTERFACE_NAME =
      ClassName.get(AST_PACKAGE, "ASTNodeInterface");
  private static final ClassName AST_NODE_UTILS_NAME = ClassName.get(AST_PACKAGE, "ASTNodeUtils");
  private static final ClassName AST_VISITOR_NAME = ClassName.get(AST_PACKAGE, "ASTVisitor");
  private static final ClassName DEFAULT_AST_VISITOR_NAME =
      ClassName.get(AST_PACKAGE, "DefaultASTVisitor");
  private static final ClassName VOID_DEFAULT_AST_VISITOR_NAME =
      ClassName.get(AST_PACKAGE, "VoidDefaultASTVisitor");
  private static final TypeVariableName V = TypeVariableName.get("V");

  private final Set<ClassName> allAstNodes =
      new TreeSet<>(Comparator.comparing(ClassName::canonicalName));
  private boolean visitorsGenerated = false;

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(ASTNode.class.getName(), ASTChild.class.getName());
  }

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    try {
      if (!annotations.isEmpty()) {
        processImpl(roundEnv);
      } else if (!visitorsGenerated && !allAstNodes.isEmpty()) {
        // First round without new nodes; generating here keeps the visitors subject to the
        // remaining rounds instead of the final one.
        generateASTVisitorFiles();
      }
    } catch (IOException ex) {
      throw new RuntimeException(ex);
    }

    return true;
  }

  private void processImpl(RoundEnvironment roundEnv) throws IOException {
    for (Element element : roundEnv.getElementsAnnotatedWith(ASTNode.class)) {
      TypeElement typeElement = (TypeElement) element;
      if (!typeElement.getTypeParameters().isEmpty()) {
        error("@ASTNode classes cannot be generic", typeElement);
        continue;
      }
      if (!packageOf(typeElement).equals(AST_PACKAGE)) {
        error("@ASTNode classes must live in package " + AST_PACKAGE, typeElement);
        continue;
      }

      try {
        writeASTNodeFile(typeElement);
      } catch (Exception ex) {
        error("APT Error: " + ex, typeElement);
      }
      allAstNodes.add(ClassName.get(typeElement));
    }
  }

  private void writeASTNodeFile(TypeElement element) throws IOException {
    String interfaceName = getASTNodeInterfaceName(element);
    // Not generated yet, so the interface is still an error type here; match it by name.
    if (element.getInterfaces().stream().noneMatch(i -> i.toString().endsWith(interfaceName))) {
      error("Missing interface: " + interfaceName, element);
      return;
    }

    ParameterSpec visitor =
        ParameterSpec.builder(ParameterizedTypeName.get(AST_VISITOR_NAME, V), "visitor").build();
    ParameterSpec value = ParameterSpec.builder(V, "value").build();

    TypeSpec.Builder typeSpecBuilder =
        TypeSpec.interfaceBuilder(interfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(AST_NODE_INTERFACE_NAME)
            .addMethod(
                MethodSpec.methodBuilder("accept")
                    .addAnnotation(Override.class)
                    .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
                    .addTypeVariable(V)
                    .returns(V)
                    .addParameter(visitor)
                    .addParameter(value)
                    .addStatement("return visitor.visit(($T) this, value)", ClassName.get(element))
                    .build());

    MethodSpec.Builder visitChildren =
        MethodSpec.methodBuilder("visitChildren")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(visitor)
            .addParameter(value);
    for (Element enclosed : element.getEnclosedElements()) {
      if (enclosed.getKind() != ElementKind.METHOD) continue;
      if (enclosed.getAnnotation(ASTChild.class) == null) continue;
      if (enclosed.getAnnotation(Override.class) == null) {
        error("Missing @Override", enclosed);
      }

      ExecutableElement method = (ExecutableElement) enclosed;
      if (!method.getParameters().isEmpty()) {
        error("@ASTChild accessors take no parameters", method);
        continue;
      }
      typeSpecBuilder.addMethod(
          MethodSpec.methodBuilder(method.getSimpleName().toString())
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(method.getReturnType()))
              .build());
      visitChildren.addStatement(
          "value = $T.accept($L(), visitor, value)", AST_NODE_UTILS_NAME, method.getSimpleName());
    }
    typeSpecBuilder.addMethod(visitChildren.addStatement("return value").build());

    writeType(typeSpecBuilder.build());
  }

  private void generateASTVisitorFiles() throws IOException {
    visitorsGenerated = true;

    TypeSpec.Builder visitor =
        TypeSpec.interfaceBuilder(AST_VISITOR_NAME.simpleName())
            .addModifiers(Modifier.PUBLIC)
            .addTypeVariable(V);
    TypeSpec.Builder defaultVisitor =
        TypeSpec.classBuilder(DEFAULT_AST_VISITOR_NAME.simpleName())
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .addTypeVariable(V)
            .addSuperinterface(ParameterizedTypeName.get(AST_VISITOR_NAME, V));
    TypeSpec.Builder voidVisitor =
        TypeSpec.classBuilder(VOID_DEFAULT_AST_VISITOR_NAME.simpleName())
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .superclass(
                ParameterizedTypeName.get(DEFAULT_AST_VISITOR_NAME, ClassName.get(Void.class)));

    for (ClassName node : allAstNodes) {
      visitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(V)
              .addParameter(node, "node")
              .addParameter(V, "value")
              .build());
      defaultVisitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC)
              .returns(V)
              .addParameter(node, "node")
              .addParameter(V, "value")
              .addStatement("return node.visitChildren(this, value)")
              .build());
      voidVisitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
              .returns(Void.class)
              .addParameter(node, "node")
              .addParameter(Void.class, "value")
              .addStatement("visitImpl(node)")
              .addStatement("return null")
              .build());
      voidVisitor.addMethod(
          MethodSpec.methodBuilder("visitImpl")
              .addModifiers(Modifier.PUBLIC)
              .addParameter(node, "node")
              .addStatement("node.visitChildren(this, null)")
              .build());
    }

    writeType(visitor.build());
    writeType(defaultVisitor.build());
    writeType(voidVisitor.build());
  }

  private void writeType(TypeSpec typeSpec) throws IOException {
    JavaFile.builder(AST_PACKAGE, typeSpec)
        .skipJavaLangImports(true)
        .build()
        .writeTo(processingEnv.getFiler());
  }

  private void error(String msg, Element element) {
    processingEnv.getMessager().printMessage(Kind.ERROR, msg, element);
  }

  private String packageOf(TypeElement element) {
    return processingEnv.getElementUtils().getPackageOf(element).getQualifiedName().toString();
  }

  // Outer_Inner_ASTNode for nested classes.
  private static String getASTNodeInterfaceName(Element element) {
    Deque<String> elems = new ArrayDeque<>();
    elems.push("ASTNode");
    do {
      if (element.getKind() == ElementKind.CLASS) {
        elems.addFirst(element.getSimpleName().toString());
      }
      element = element.getEnclosingElement();
    } while (element.getKind() != ElementKind.PACKAGE);
    return elems.stream().collect(Collectors.joining("_"));
  }
}
